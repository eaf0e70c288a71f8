package com.dataPlatform.platformFacade.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Utility class for extracting downloaded zip archives.
 */
@Slf4j
public class ZipArchives {

    /**
     * Extracts every entry of {@code archive} under {@code targetDirectory}.
     * Entries resolving outside the target directory are rejected.
     *
     * @param archive Zip file
     * @param targetDirectory Destination directory (created if missing)
     * @return Extracted file paths
     * @throws IOException if the archive cannot be read or an entry escapes the target
     */
    public static List<Path> extract(Path archive, Path targetDirectory) throws IOException {
        Path root = targetDirectory.toAbsolutePath().normalize();
        Files.createDirectories(root);

        List<Path> extracted = new ArrayList<>();
        try (InputStream in = Files.newInputStream(archive); ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Zip entry outside target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zip, target, StandardCopyOption.REPLACE_EXISTING);
                    extracted.add(target);
                }
                zip.closeEntry();
            }
        }

        log.debug("Extracted archive - archive: {}, files: {}", archive, extracted.size());
        return extracted;
    }

    /**
     * Returns true if the file starts with the zip local-header signature.
     */
    public static boolean isZip(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] header = in.readNBytes(4);
            return header.length == 4 && header[0] == 'P' && header[1] == 'K' && header[2] == 3 && header[3] == 4;
        }
    }
}
