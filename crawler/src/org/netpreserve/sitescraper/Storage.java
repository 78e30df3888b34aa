package org.netpreserve.sitescraper;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.util.Filenames;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes crawl output to a directory:
 * <pre>
 *   data.jsonl           one JSON record per processed page, appended
 *   pages/&lt;sha1&gt;.html    saved documents, named by the SHA-1 of their address
 *   assets/images/       downloaded images
 * </pre>
 */
public class Storage implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Storage.class);
    private final Path pagesDir;
    private final Path imagesDir;
    private final Path recordsFile;
    private final ObjectMapper mapper;
    private final Lock recordLock = new ReentrantLock();
    private BufferedWriter recordWriter;

    public Storage(Path directory, ObjectMapper mapper) throws IOException {
        this.mapper = mapper;
        this.pagesDir = directory.resolve("pages");
        this.imagesDir = directory.resolve("assets").resolve("images");
        this.recordsFile = directory.resolve("data.jsonl");
        Files.createDirectories(pagesDir);
        Files.createDirectories(imagesDir);
    }

    public Path saveDocument(Url url, String html) throws IOException {
        Path path = pagesDir.resolve(Filenames.sha1Hex(url.toString()) + ".html");
        Files.writeString(path, html, StandardCharsets.UTF_8);
        return path;
    }

    /**
     * Saves a downloaded asset. The suggested name is prefixed with a short hash of the source address so that
     * images from different paths sharing a name don't overwrite each other.
     */
    public Path saveBinary(Url url, byte[] data, @Nullable String suggestedName) throws IOException {
        String filename;
        if (suggestedName != null && !suggestedName.isBlank()) {
            filename = Filenames.sha1Hex(url.toString()).substring(0, 10) + "-" + Filenames.sanitize(suggestedName);
        } else {
            filename = Filenames.sha1Hex(data);
        }
        Path path = imagesDir.resolve(filename);
        Files.write(path, data);
        return path;
    }

    public void appendRecord(PageRecord record) throws IOException {
        String line = mapper.writeValueAsString(record);
        recordLock.lock();
        try {
            if (recordWriter == null) {
                recordWriter = Files.newBufferedWriter(recordsFile, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
            recordWriter.write(line);
            recordWriter.write('\n');
            recordWriter.flush();
        } finally {
            recordLock.unlock();
        }
        log.atDebug().addKeyValue("url", record.url()).log("Appended record");
    }

    public Path recordsFile() {
        return recordsFile;
    }

    @Override
    public void close() throws IOException {
        recordLock.lock();
        try {
            if (recordWriter != null) {
                recordWriter.close();
                recordWriter = null;
            }
        } finally {
            recordLock.unlock();
        }
    }
}
