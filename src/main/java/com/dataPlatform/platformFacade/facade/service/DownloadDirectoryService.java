package com.dataPlatform.platformFacade.facade.service;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Prepares download directories and reports what landed in them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadDirectoryService {

    private final FacadeSettings settings;

    /**
     * Resolves the download path (caller override or configured default) and creates it.
     *
     * @param customPath Caller-supplied path, may be null
     * @return Existing directory
     * @throws IOException if the directory cannot be created
     */
    public Path ensureDownloadDirectory(String customPath) throws IOException {
        Path directory = Path.of(settings.resolveDownloadPath(customPath));
        Files.createDirectories(directory);
        log.debug("Download directory ready - path: {}", directory.toAbsolutePath());
        return directory;
    }

    /**
     * Resolves {@code child} under {@code directory}, refusing results outside it.
     *
     * @throws IllegalArgumentException if the resolved path leaves {@code directory}
     */
    public Path resolveInside(Path directory, String child) {
        Path root = directory.toAbsolutePath().normalize();
        Path resolved = root.resolve(child).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Path '" + child + "' resolves outside download directory");
        }
        return resolved;
    }

    /**
     * Names of regular files directly inside {@code directory}, sorted.
     * Empty if the directory does not exist.
     */
    public List<String> listFiles(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .toList();
        }
    }
}
