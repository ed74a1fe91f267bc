package fr.imt.pbdeployer.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds release zips in memory.
 */
public final class ReleaseArchives {

    private ReleaseArchives() {
    }

    public static byte[] valid() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("pocketbase", "#!binary");
        entries.put("pb_public/", null);
        entries.put("pb_public/index.html", "<html></html>");
        entries.put("pb_migrations/1700000000_init.js", "migrate()");
        return zip(entries);
    }

    /**
     * A {@code null} value creates a directory entry.
     */
    public static byte[] zip(Map<String, String> entries) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                if (entry.getValue() != null) {
                    zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                }
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
