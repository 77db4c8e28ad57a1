package com.eventfullyengineered.jstreamlistener.common;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class InputStreams {

    private InputStreams() {
        // statics only
    }

    public static String asString(InputStream in) throws IOException {
        try (BufferedInputStream bis = new BufferedInputStream(in)) {
            ByteArrayOutputStream buf = new ByteArrayOutputStream();
            byte[] chunk = new byte[4096];
            int read;
            while ((read = bis.read(chunk)) != -1) {
                buf.write(chunk, 0, read);
            }
            return buf.toString(StandardCharsets.UTF_8.name());
        }
    }

}
