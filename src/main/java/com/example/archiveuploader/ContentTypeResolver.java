package com.example.archiveuploader;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

/**
 * Guesses an object's content type from its archive entry name.
 */
public class ContentTypeResolver {
    static final String DEFAULT_TYPE = "application/octet-stream";

    private final Tika tika;

    public ContentTypeResolver(Tika tika) {
        this.tika = tika;
    }

    public String resolve(String name) {
        String detected = tika.detect(name);
        MediaType mediaType = detected == null ? null : MediaType.parse(detected);
        return mediaType == null ? DEFAULT_TYPE : mediaType.toString();
    }
}
