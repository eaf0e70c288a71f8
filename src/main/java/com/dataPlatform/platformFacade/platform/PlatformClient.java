package com.dataPlatform.platformFacade.platform;

import com.dataPlatform.platformFacade.platform.exception.PlatformClientException;
import com.dataPlatform.platformFacade.platform.model.CompetitionRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetFileRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetQuery;
import com.dataPlatform.platformFacade.platform.model.DatasetRecord;
import com.dataPlatform.platformFacade.platform.model.ModelQuery;
import com.dataPlatform.platformFacade.platform.model.ModelRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Authenticated client of the data platform.
 *
 * Every method may block on network I/O and reports failures as
 * {@link PlatformClientException}.
 */
public interface PlatformClient {

    List<CompetitionRecord> listCompetitions();

    /**
     * Downloads one competition file into {@code path}.
     *
     * @param force Overwrite an existing local file
     * @param quiet Suppress progress logging
     */
    void competitionDownloadFile(String competitionId, String fileName, Path path, boolean force, boolean quiet);

    /**
     * Downloads all competition files into {@code path/competitionId}.
     */
    void competitionDownloadFiles(String competitionId, Path path, boolean force, boolean quiet);

    List<DatasetRecord> listDatasets(DatasetQuery query);

    DatasetRecord viewDataset(String owner, String datasetName);

    List<DatasetFileRecord> listDatasetFiles(String owner, String datasetName);

    void datasetDownloadFile(String owner, String datasetName, String fileName, Path path, boolean force, boolean quiet);

    /**
     * Downloads a whole dataset into {@code path/datasetName}.
     *
     * @param unzip Extract the downloaded archive
     */
    void datasetDownloadFiles(String owner, String datasetName, Path path, boolean force, boolean quiet, boolean unzip);

    List<ModelRecord> listModels(ModelQuery query);
}
