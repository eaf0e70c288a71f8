package com.dataPlatform.platformFacade.platform;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.platform.exception.PlatformClientException;
import com.dataPlatform.platformFacade.platform.model.CompetitionRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetFileRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetQuery;
import com.dataPlatform.platformFacade.platform.model.DatasetRecord;
import com.dataPlatform.platformFacade.platform.model.ModelQuery;
import com.dataPlatform.platformFacade.platform.model.ModelRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestToUriTemplate;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class KagglePlatformClientTest {

    private static final String BASE_URL = "https://api.example.test/v1";

    @TempDir
    Path downloadRoot;

    private MockRestServiceServer server;
    private KagglePlatformClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new KagglePlatformClient(builder, FacadeSettings.builder()
                .apiBaseUrl(BASE_URL)
                .username("tester")
                .apiKey("secret")
                .build());
    }

    @Test
    void listCompetitions_SendsBasicAuthAndMapsRecords() {
        // given
        String basic = Base64.getEncoder().encodeToString("tester:secret".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(BASE_URL + "/competitions/list"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Basic " + basic))
                .andRespond(withSuccess("""
                        [{"id": 3136, "ref": "titanic", "title": "Titanic",
                          "url": "https://www.kaggle.com/competitions/titanic",
                          "category": "Getting Started", "reward": "Knowledge",
                          "deadline": "2030-01-07T23:59:00", "teamCount": 15000,
                          "tags": [{"ref": "tabular", "name": "Tabular"}],
                          "enabledDate": "2012-09-28T21:13:33.55Z", "somethingNew": true}]
                        """, MediaType.APPLICATION_JSON));

        // when
        List<CompetitionRecord> competitions = client.listCompetitions();

        // then
        server.verify();
        assertThat(competitions).singleElement().satisfies(competition -> {
            assertThat(competition.getId()).isEqualTo(3136L);
            assertThat(competition.getTotalTeams()).isEqualTo(15000);
            assertThat(competition.getDeadline()).isEqualTo(Instant.parse("2030-01-07T23:59:00Z"));
            assertThat(competition.getEnabledDate()).isEqualTo(Instant.parse("2012-09-28T21:13:33.550Z"));
            assertThat(competition.getTags()).extracting("name").containsExactly("Tabular");
        });
    }

    @Test
    void listCompetitions_Unauthorized_MessageStartsWithStatus() {
        // given
        server.expect(requestTo(BASE_URL + "/competitions/list"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"message\":\"bad key\"}"));

        // when / then
        assertThatThrownBy(() -> client.listCompetitions())
                .isInstanceOf(PlatformClientException.class)
                .hasMessageStartingWith("401 Unauthorized - list competitions");
    }

    @Test
    void listCompetitions_SocketTimeout_MessageMentionsTimeout() {
        // given
        server.expect(requestTo(BASE_URL + "/competitions/list"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        // when / then
        assertThatThrownBy(() -> client.listCompetitions())
                .isInstanceOf(PlatformClientException.class)
                .hasMessageStartingWith("Request timeout - list competitions");
    }

    @Test
    void listDatasets_SendsOnlySetFilters() {
        // given
        server.expect(requestTo(startsWith(BASE_URL + "/datasets/list")))
                .andExpect(queryParam("search", "titanic"))
                .andExpect(queryParam("sortBy", "votes"))
                .andExpect(queryParam("filetype", "csv"))
                .andExpect(queryParam("page", "2"))
                .andExpect(request -> assertThat(request.getURI().getQuery()).doesNotContain("license"))
                .andRespond(withSuccess("""
                        [{"ref": "alice/titanic", "title": "Titanic", "totalBytes": 2048,
                          "lastUpdated": "2024-11-02T08:00:00.000Z", "downloadCount": 10,
                          "usabilityRating": 0.88, "licenseName": "CC0-1.0"}]
                        """, MediaType.APPLICATION_JSON));

        // when
        List<DatasetRecord> datasets = client.listDatasets(DatasetQuery.builder()
                .search("titanic")
                .sortBy("votes")
                .fileType("csv")
                .page(2)
                .build());

        // then
        server.verify();
        assertThat(datasets).singleElement().satisfies(dataset -> {
            assertThat(dataset.getSize().bytes()).isEqualTo(2048L);
            assertThat(dataset.getLastUpdated()).isEqualTo(Instant.parse("2024-11-02T08:00:00Z"));
        });
    }

    @Test
    void viewDataset_NotFound_MessageStartsWithStatus() {
        // given
        server.expect(requestToUriTemplate(BASE_URL + "/datasets/view/{owner}/{slug}", "alice", "gone"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        // when / then
        assertThatThrownBy(() -> client.viewDataset("alice", "gone"))
                .isInstanceOf(PlatformClientException.class)
                .hasMessageStartingWith("404 Not Found");
    }

    @Test
    void listDatasetFiles_MapsFiles() {
        // given
        server.expect(requestTo(BASE_URL + "/datasets/list/alice/titanic"))
                .andRespond(withSuccess("""
                        {"datasetFiles": [{"name": "train.csv", "totalBytes": 1536, "creationDate": "2024-11-01"}]}
                        """, MediaType.APPLICATION_JSON));

        // when
        List<DatasetFileRecord> files = client.listDatasetFiles("alice", "titanic");

        // then
        assertThat(files).singleElement().satisfies(file -> {
            assertThat(file.getName()).isEqualTo("train.csv");
            assertThat(file.getSize().display()).isEqualTo("1.5 KB");
            assertThat(file.getCreationDate()).isEqualTo(Instant.parse("2024-11-01T00:00:00Z"));
        });
    }

    @Test
    void listModels_SendsPageTokenAndMapsPrivateFlag() {
        // given
        server.expect(requestTo(startsWith(BASE_URL + "/models/list")))
                .andExpect(queryParam("pageToken", "2"))
                .andExpect(queryParam("pageSize", "20"))
                .andRespond(withSuccess("""
                        {"models": [{"id": 1, "ref": "google/gemma", "isPrivate": true,
                                     "publishTime": "2024-02-21T00:00:00Z"}],
                         "nextPageToken": "3"}
                        """, MediaType.APPLICATION_JSON));

        // when
        List<ModelRecord> models = client.listModels(ModelQuery.builder().pageSize(20).pageToken("2").build());

        // then
        assertThat(models).singleElement().satisfies(model -> {
            assertThat(model.getPrivateModel()).isTrue();
            assertThat(model.getPublishTime()).isEqualTo(Instant.parse("2024-02-21T00:00:00Z"));
        });
    }

    @Test
    void competitionDownloadFile_WritesBodyToSanitizedName() throws IOException {
        // given
        server.expect(requestTo(BASE_URL + "/competitions/data/download/titanic/train.csv"))
                .andRespond(withSuccess("id,survived\n1,0\n", MediaType.APPLICATION_OCTET_STREAM));

        // when
        client.competitionDownloadFile("titanic", "train.csv", downloadRoot, false, true);

        // then
        assertThat(Files.readString(downloadRoot.resolve("train.csv"))).isEqualTo("id,survived\n1,0\n");
    }

    @Test
    void competitionDownloadFile_ExistingWithoutForce_IsSkipped() throws IOException {
        // given
        Files.writeString(downloadRoot.resolve("train.csv"), "local");

        // when
        client.competitionDownloadFile("titanic", "train.csv", downloadRoot, false, true);

        // then
        server.verify();
        assertThat(Files.readString(downloadRoot.resolve("train.csv"))).isEqualTo("local");
    }

    @Test
    void competitionDownloadFiles_ExtractsArchiveAndRemovesIt() throws IOException {
        // given
        server.expect(requestTo(BASE_URL + "/competitions/data/download-all/titanic"))
                .andRespond(withSuccess(zip("train.csv", "a\n", "test.csv", "b\n"), MediaType.APPLICATION_OCTET_STREAM));

        // when
        client.competitionDownloadFiles("titanic", downloadRoot, false, true);

        // then
        Path directory = downloadRoot.resolve("titanic");
        assertThat(Files.readString(directory.resolve("train.csv"))).isEqualTo("a\n");
        assertThat(directory.resolve("test.csv")).exists();
        assertThat(directory.resolve("titanic.zip")).doesNotExist();
    }

    @Test
    void datasetDownloadFiles_WithoutUnzip_KeepsArchive() throws IOException {
        // given
        server.expect(requestTo(BASE_URL + "/datasets/download/alice/titanic"))
                .andRespond(withSuccess(zip("passengers.csv", "x\n"), MediaType.APPLICATION_OCTET_STREAM));

        // when
        client.datasetDownloadFiles("alice", "titanic", downloadRoot, false, true, false);

        // then
        assertThat(downloadRoot.resolve("titanic").resolve("titanic.zip")).exists();
        assertThat(downloadRoot.resolve("titanic").resolve("passengers.csv")).doesNotExist();
    }

    @Test
    void datasetDownloadFile_Forbidden_MessageStartsWithStatus() {
        // given
        server.expect(requestTo(BASE_URL + "/datasets/download/alice/titanic/train.csv"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));

        // when / then
        assertThatThrownBy(() -> client.datasetDownloadFile("alice", "titanic", "train.csv", downloadRoot, true, true))
                .isInstanceOf(PlatformClientException.class)
                .hasMessageStartingWith("403 Forbidden");
        assertThat(downloadRoot.resolve("train.csv")).doesNotExist();
    }

    @Test
    void datasetDownloadFiles_ParentDirectoryName_IsRejectedBeforeAnyRequest() throws IOException {
        // given
        Path inner = Files.createDirectories(downloadRoot.resolve("downloads"));

        // when / then
        assertThatThrownBy(() -> client.datasetDownloadFiles("alice", "..", inner, false, true, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> client.competitionDownloadFiles("a/../..", inner, false, true))
                .isInstanceOf(IllegalArgumentException.class);
        server.verify();
    }

    private static byte[] zip(String... namesAndContents) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                zip.putNextEntry(new ZipEntry(namesAndContents[i]));
                zip.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }
}
