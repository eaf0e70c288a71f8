package com.dataPlatform.platformFacade.gateway.controller;

import com.dataPlatform.platformFacade.facade.dto.CompetitionSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.DatasetSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.DownloadRequest;
import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.error.ErrorClassifier;
import com.dataPlatform.platformFacade.facade.error.ErrorKind;
import com.dataPlatform.platformFacade.facade.service.CompetitionService;
import com.dataPlatform.platformFacade.facade.service.DatasetService;
import com.dataPlatform.platformFacade.facade.service.ModelService;
import com.dataPlatform.platformFacade.report.service.PlatformReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class PlatformControllerTest {

    @Mock
    private CompetitionService competitionService;

    @Mock
    private DatasetService datasetService;

    @Mock
    private ModelService modelService;

    @Mock
    private PlatformReportService reportService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new PlatformController(competitionService, datasetService, modelService, reportService))
                .setControllerAdvice(new GlobalExceptionHandler(new ErrorClassifier()))
                .build();
    }

    @Test
    void searchCompetitions_BindsQueryParameters() throws Exception {
        // given
        when(competitionService.searchCompetitions(any(CompetitionSearchRequest.class)))
                .thenReturn(OperationResponse.success(Map.of("competitions", List.of(), "total_count", 0)));
        ArgumentCaptor<CompetitionSearchRequest> request = ArgumentCaptor.forClass(CompetitionSearchRequest.class);

        // when / then
        mockMvc.perform(get("/api/v1/platform/competitions")
                        .param("search", "titanic")
                        .param("sortBy", "numberOfTeams")
                        .param("page", "2")
                        .param("pageSize", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.total_count").value(0));

        verify(competitionService).searchCompetitions(request.capture());
        assertThat(request.getValue().getSearch()).isEqualTo("titanic");
        assertThat(request.getValue().getSortBy()).isEqualTo("numberOfTeams");
        assertThat(request.getValue().getPage()).isEqualTo(2);
        assertThat(request.getValue().getPageSize()).isEqualTo(5);
        assertThat(request.getValue().getCategory()).isNull();
    }

    @Test
    void errorEnvelope_IsReturnedWithOk() throws Exception {
        // given
        when(competitionService.getCompetitionDetails("missing"))
                .thenReturn(OperationResponse.error(ErrorKind.NOT_FOUND, "Resource not found. Please check the identifier."));

        // when / then
        mockMvc.perform(get("/api/v1/platform/competitions/missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error").value("Resource not found. Please check the identifier."))
                .andExpect(jsonPath("$.error_type").value("not_found_error"))
                .andExpect(jsonPath("$.status").doesNotExist());
    }

    @Test
    void downloadCompetitionFiles_TakesTargetFromPath() throws Exception {
        // given
        when(competitionService.downloadCompetitionFiles(any(DownloadRequest.class)))
                .thenReturn(OperationResponse.success(Map.of("total_files", 1)));
        ArgumentCaptor<DownloadRequest> request = ArgumentCaptor.forClass(DownloadRequest.class);

        // when / then
        mockMvc.perform(post("/api/v1/platform/competitions/titanic/download")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fileName\": \"train.csv\", \"force\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_files").value(1));

        verify(competitionService).downloadCompetitionFiles(request.capture());
        assertThat(request.getValue().getTarget()).isEqualTo("titanic");
        assertThat(request.getValue().getFileName()).isEqualTo("train.csv");
        assertThat(request.getValue().isForce()).isTrue();
    }

    @Test
    void downloadCompetitionFiles_WithoutBody_UsesDefaults() throws Exception {
        // given
        when(competitionService.downloadCompetitionFiles(any(DownloadRequest.class)))
                .thenReturn(OperationResponse.success(Map.of("total_files", 0)));
        ArgumentCaptor<DownloadRequest> request = ArgumentCaptor.forClass(DownloadRequest.class);

        // when
        mockMvc.perform(post("/api/v1/platform/competitions/titanic/download"))
                .andExpect(status().isOk());

        // then
        verify(competitionService).downloadCompetitionFiles(request.capture());
        assertThat(request.getValue().getTarget()).isEqualTo("titanic");
        assertThat(request.getValue().quietOrDefault()).isTrue();
    }

    @Test
    void getDatasetDetails_PassesReferenceThrough() throws Exception {
        // given
        when(datasetService.getDatasetDetails("alice/titanic"))
                .thenReturn(OperationResponse.success(Map.of("ref", "alice/titanic")));

        // when / then
        mockMvc.perform(get("/api/v1/platform/datasets/detail").param("ref", "alice/titanic"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ref").value("alice/titanic"));
    }

    @Test
    void searchDatasets_NonNumericPage_IsValidationEnvelope() throws Exception {
        mockMvc.perform(get("/api/v1/platform/datasets").param("page", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_type").value("validation_error"));
    }

    @Test
    void searchDatasets_BindsFilters() throws Exception {
        // given
        when(datasetService.searchDatasets(any(DatasetSearchRequest.class)))
                .thenReturn(OperationResponse.success(Map.of("datasets", List.of())));
        ArgumentCaptor<DatasetSearchRequest> request = ArgumentCaptor.forClass(DatasetSearchRequest.class);

        // when
        mockMvc.perform(get("/api/v1/platform/datasets").param("fileType", "csv").param("tagIds", "tabular"))
                .andExpect(status().isOk());

        // then
        verify(datasetService).searchDatasets(request.capture());
        assertThat(request.getValue().getFileType()).isEqualTo("csv");
        assertThat(request.getValue().getTagIds()).isEqualTo("tabular");
    }

    @Test
    void report_IsServedAsMarkdown() throws Exception {
        // given
        when(reportService.platformStatistics()).thenReturn("# Platform Statistics\n");

        // when / then
        mockMvc.perform(get("/api/v1/platform/reports/platform-stats"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/markdown"))
                .andExpect(content().string("# Platform Statistics\n"));
    }

    @Test
    void hotTopicsAndGuide_AreServedAsMarkdown() throws Exception {
        // given
        when(reportService.hotTopics()).thenReturn("# Trending Topics & Techniques\n");
        when(reportService.beginnerGuide()).thenReturn("# Getting Started Guide\n");

        // when / then
        mockMvc.perform(get("/api/v1/platform/reports/hot-topics"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/markdown"))
                .andExpect(content().string("# Trending Topics & Techniques\n"));
        mockMvc.perform(get("/api/v1/platform/reports/getting-started"))
                .andExpect(status().isOk())
                .andExpect(content().string("# Getting Started Guide\n"));
    }
}
