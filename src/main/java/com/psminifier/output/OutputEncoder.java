package com.psminifier.output;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;
import java.util.zip.GZIPOutputStream;

/**
 * Wraps minified script text for delivery: optionally as a self-decoding GZip/Base64 script block,
 * dot-sourced, and bound to a variable.
 */
public class OutputEncoder {

    private static final String TEMPLATE_PREFIX = "([ScriptBlock]::Create(([IO.StreamReader]::new("
            + "[IO.Compression.GZipStream]::new([IO.MemoryStream]::new([Convert]::FromBase64String('";
    private static final String TEMPLATE_SUFFIX = "')),[IO.Compression.CompressionMode]'Decompress'),"
            + "[Text.Encoding]::Unicode)).ReadToEnd()))";

    private static final int LINE_LENGTH = 76;
    private static final Pattern WORD = Pattern.compile("\\w+");

    private final boolean compress;
    private final boolean singleLine;
    private final boolean dotSource;
    private final String bindingName;
    private final boolean anonymous;

    public OutputEncoder(boolean compress, boolean singleLine, boolean dotSource,
                         String bindingName, boolean anonymous) {
        if (singleLine && !compress) {
            throw new IllegalArgumentException("Single-line output only applies to compressed output");
        }
        this.compress = compress;
        this.singleLine = singleLine;
        this.dotSource = dotSource;
        this.bindingName = bindingName;
        this.anonymous = anonymous;
    }

    public String encode(String text) {
        String result = compress ? selfDecoding(text) : text;
        if (dotSource) {
            result = compress ? ". " + result : ". {" + result + "}";
        }
        if (bindingName != null && !bindingName.isEmpty() && !anonymous) {
            if (!compress && !dotSource) {
                result = "{" + result + "}";
            }
            result = variable(bindingName) + "=" + result;
        }
        return result;
    }

    private String selfDecoding(String text) {
        byte[] gzipped = gzip(text.getBytes(StandardCharsets.UTF_16LE));
        Base64.Encoder encoder = singleLine
                ? Base64.getEncoder()
                : Base64.getMimeEncoder(LINE_LENGTH, "\n".getBytes(StandardCharsets.US_ASCII));
        return TEMPLATE_PREFIX + encoder.encodeToString(gzipped) + TEMPLATE_SUFFIX;
    }

    static byte[] gzip(byte[] bytes) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(bytes.length / 2 + 32);
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot gzip script text", e);
        }
        return buffer.toByteArray();
    }

    private static String variable(String name) {
        return WORD.matcher(name).matches() ? "$" + name : "${" + name + "}";
    }
}
