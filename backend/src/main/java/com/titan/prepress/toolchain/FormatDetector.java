package com.titan.prepress.toolchain;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Detects the upload format. Precedence, most to least reliable: magic bytes, declared MIME
 * type, filename extension, then PDF. An extension outside the supported set with nothing
 * else to go on yields {@link FileFormat#UNKNOWN}.
 */
public final class FormatDetector {

    static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] JPEG_MAGIC = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] TIFF_LE_MAGIC = {0x49, 0x49, 0x2A, 0x00};
    private static final byte[] TIFF_BE_MAGIC = {0x4D, 0x4D, 0x00, 0x2A};
    private static final byte[] PSD_MAGIC = "8BPS".getBytes(StandardCharsets.US_ASCII);

    private FormatDetector() {
    }

    public static FileFormat detect(byte[] content, String mimeType, String filename) {
        String ext = extension(filename);

        if (startsWith(content, PDF_MAGIC)) {
            return "ai".equals(ext) ? FileFormat.AI : FileFormat.PDF;
        }
        if (startsWith(content, JPEG_MAGIC)) {
            return FileFormat.JPG;
        }
        if (startsWith(content, PNG_MAGIC)) {
            return FileFormat.PNG;
        }
        if (startsWith(content, TIFF_LE_MAGIC) || startsWith(content, TIFF_BE_MAGIC)) {
            return FileFormat.TIFF;
        }
        if (startsWith(content, PSD_MAGIC)) {
            return FileFormat.PSD;
        }

        String mime = mimeType == null ? "" : mimeType.toLowerCase(Locale.ROOT);
        if (mime.contains("pdf")) {
            return FileFormat.PDF;
        }
        if (mime.contains("jpeg") || mime.contains("jpg")) {
            return FileFormat.JPG;
        }
        if (mime.contains("png")) {
            return FileFormat.PNG;
        }
        if (mime.contains("tif")) {
            return FileFormat.TIFF;
        }
        if (mime.contains("photoshop")) {
            return FileFormat.PSD;
        }
        if (mime.contains("illustrator") || mime.contains("postscript")) {
            return FileFormat.AI;
        }

        return switch (ext) {
            case "", "pdf" -> FileFormat.PDF;
            case "jpg", "jpeg" -> FileFormat.JPG;
            case "png" -> FileFormat.PNG;
            case "tif", "tiff" -> FileFormat.TIFF;
            case "ai" -> FileFormat.AI;
            case "psd" -> FileFormat.PSD;
            default -> FileFormat.UNKNOWN;
        };
    }

    static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        String name = filename.substring(Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\')) + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static boolean startsWith(byte[] content, byte[] prefix) {
        if (content == null || content.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (content[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
