package com.example.archiveuploader.archive;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads tar archives, gzip compressed or not, from a local file.
 */
public final class TarArchiveReader implements ArchiveReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(TarArchiveReader.class);
    private static final int SIGNATURE_LENGTH = 2;

    private final Path archive;

    public TarArchiveReader(Path archive) {
        this.archive = archive;
    }

    @Override
    public EntrySource openScan() throws IOException {
        InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
        try {
            InputStream decompressed = isGzip(raw) ? new GzipCompressorInputStream(raw, true) : raw;
            LOGGER.debug("Opened scan over {}", archive);
            return new TarEntrySource(new TarArchiveInputStream(decompressed));
        } catch (IOException ex) {
            raw.close();
            throw new ArchiveDecodeException("Failed to open archive " + archive, ex);
        }
    }

    static String normalizeName(String name) {
        String normalized = name.replace('\\', '/');
        while (normalized.startsWith("./") || normalized.startsWith("/")) {
            normalized = normalized.startsWith("./") ? normalized.substring(2) : normalized.substring(1);
        }
        return normalized.replaceAll("/(\\./)+", "/").replaceAll("/{2,}", "/");
    }

    private static boolean isGzip(InputStream in) throws IOException {
        byte[] signature = new byte[SIGNATURE_LENGTH];
        in.mark(SIGNATURE_LENGTH);
        int read = in.readNBytes(signature, 0, SIGNATURE_LENGTH);
        in.reset();
        return GzipCompressorInputStream.matches(signature, read);
    }

    private final class TarEntrySource implements EntrySource {
        private final TarArchiveInputStream tar;

        private TarEntrySource(TarArchiveInputStream tar) {
            this.tar = tar;
        }

        @Override
        public ArchiveEntry next() throws IOException {
            TarArchiveEntry entry;
            try {
                entry = tar.getNextEntry();
            } catch (IOException | IllegalArgumentException ex) {
                throw new ArchiveDecodeException("Malformed archive " + archive, ex);
            }
            if (entry == null) {
                return null;
            }
            long size = entry.isFile() ? entry.getSize() : 0L;
            return new ArchiveEntry(normalizeName(entry.getName()), size, new EntryBody(tar));
        }

        @Override
        public void close() throws IOException {
            tar.close();
        }
    }

    /**
     * Body view over the current tar entry; closing it leaves the archive open.
     */
    private static final class EntryBody extends FilterInputStream {
        private EntryBody(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // the scan owns the underlying stream
        }
    }
}
