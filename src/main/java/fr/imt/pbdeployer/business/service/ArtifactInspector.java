package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.ArtifactLayout;
import fr.imt.pbdeployer.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Checks a release zip locally before anything is sent to a server.
 */
@Component
public class ArtifactInspector {

    static final String PUBLIC_DIR = "pb_public";
    static final String MIGRATIONS_DIR = "pb_migrations";
    static final String HOOKS_DIR = "pb_hooks";

    /**
     * @throws ValidationException when the archive is unreadable, escapes its root,
     *                             or lacks the binary or {@code pb_public/} at its root
     */
    public ArtifactLayout inspect(byte[] archive, String binaryName) {
        if (archive == null || archive.length == 0) {
            throw new ValidationException("Artifact is empty");
        }

        Set<String> rootFiles = new HashSet<>();
        Set<String> rootDirectories = new HashSet<>();
        int entries = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                entries++;
                String name = entry.getName().replace('\\', '/');
                if (name.startsWith("/") || List.of(name.split("/")).contains("..")) {
                    throw new ValidationException("Artifact entry escapes the archive root: " + name);
                }
                int slash = name.indexOf('/');
                if (slash < 0) {
                    if (!entry.isDirectory()) {
                        rootFiles.add(name);
                    }
                } else {
                    rootDirectories.add(name.substring(0, slash));
                }
            }
        } catch (IOException e) {
            throw new ValidationException("Artifact is not a readable zip archive", e);
        }

        if (entries == 0) {
            throw new ValidationException("Artifact is not a zip archive or contains no files");
        }
        if (!rootFiles.contains(binaryName)) {
            throw new ValidationException("Artifact is missing the '" + binaryName + "' binary at its root");
        }
        if (!rootDirectories.contains(PUBLIC_DIR)) {
            throw new ValidationException("Artifact is missing the " + PUBLIC_DIR + "/ directory");
        }
        return new ArtifactLayout(binaryName,
                rootDirectories.contains(MIGRATIONS_DIR),
                rootDirectories.contains(HOOKS_DIR),
                entries,
                archive.length);
    }
}
