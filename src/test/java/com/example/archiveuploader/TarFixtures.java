package com.example.archiveuploader;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds small tar archives for tests.
 */
public final class TarFixtures {
    private TarFixtures() {
    }

    public record Item(String name, byte[] content) {
        public boolean isDirectory() {
            return name.endsWith("/");
        }
    }

    public static Item file(String name, String content) {
        return new Item(name, content.getBytes(StandardCharsets.UTF_8));
    }

    public static Item file(String name, int size) {
        byte[] content = new byte[size];
        for (int i = 0; i < size; i++) {
            content[i] = (byte) ('a' + i % 26);
        }
        return new Item(name, content);
    }

    public static Item directory(String name) {
        return new Item(name.endsWith("/") ? name : name + "/", new byte[0]);
    }

    public static Path tar(Path target, List<Item> items) throws IOException {
        writeTar(Files.newOutputStream(target), items);
        return target;
    }

    public static Path tarGz(Path target, List<Item> items) throws IOException {
        writeTar(new GzipCompressorOutputStream(Files.newOutputStream(target)), items);
        return target;
    }

    /**
     * Overwrites the size field of the header starting at {@code headerOffset}
     * with bytes that are not valid octal.
     */
    public static void corruptSizeField(Path tar, long headerOffset) throws IOException {
        try (RandomAccessFile file = new RandomAccessFile(tar.toFile(), "rw")) {
            file.seek(headerOffset + 124);
            file.write("zzzzzzzzzzz".getBytes(StandardCharsets.US_ASCII));
        }
    }

    private static void writeTar(OutputStream out, List<Item> items) throws IOException {
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            for (Item item : items) {
                TarArchiveEntry entry = new TarArchiveEntry(item.name());
                if (!item.isDirectory()) {
                    entry.setSize(item.content().length);
                }
                tar.putArchiveEntry(entry);
                if (!item.isDirectory()) {
                    tar.write(item.content());
                }
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
    }
}
