package com.production.log_rag_service.ingestion.source;

import com.production.log_rag_service.ingestion.LedgerView;
import com.production.log_rag_service.ingestion.MalformedContentException;
import com.production.log_rag_service.ingestion.SourceDocument;
import com.production.log_rag_service.ingestion.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Enumerates the files of one extension in a flat directory and versions them
 * by last-modified time. A touch without an edit therefore counts as a change.
 */
@Slf4j
final class DirectoryScanner {

    private final Path directory;
    private final String extension;

    DirectoryScanner(Path directory, String extension) {
        this.directory = directory.toAbsolutePath().normalize();
        this.extension = extension;
    }

    Path directory() {
        return directory;
    }

    /**
     * File name to path, sorted by name.
     */
    Map<String, Path> listFiles() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException("Directory does not exist: " + directory);
        }
        if (!Files.isReadable(directory)) {
            throw new SourceUnavailableException("Directory is not readable: " + directory);
        }

        Map<String, Path> files = new LinkedHashMap<>();
        try (Stream<Path> stream = Files.list(directory)) {
            stream.filter(Files::isRegularFile)
                    // Case-sensitive, so a.json and a.JSON never share chunk keys
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .forEach(p -> files.put(p.getFileName().toString(), p));
        }
        return files;
    }

    List<SourceDocument> diff(String sourceId, LedgerView existing) throws IOException {
        List<SourceDocument> results = new ArrayList<>();
        for (Map.Entry<String, Path> file : listFiles().entrySet()) {
            String version = versionOf(file.getValue());
            if (existing.isNewOrModified(file.getKey(), version)) {
                results.add(new SourceDocument(file.getKey(), sourceId, version));
            }
        }
        log.debug("{} new or modified {} files in {}", results.size(), extension, directory);
        return results;
    }

    List<SourceDocument> findDeleted(LedgerView existing) throws IOException {
        Map<String, Path> files = listFiles();
        return existing.documents().stream()
                .filter(document -> !files.containsKey(document.id()))
                .toList();
    }

    /**
     * Resolves a document id to its file, refusing ids that escape the directory.
     */
    Path resolve(String documentId) {
        Path file = directory.resolve(documentId).normalize();
        if (!file.getParent().equals(directory)) {
            throw new MalformedContentException("Document id does not name a file in " + directory + ": " + documentId);
        }
        return file;
    }

    static String versionOf(Path file) throws IOException {
        return Files.getLastModifiedTime(file).toInstant().toString();
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
