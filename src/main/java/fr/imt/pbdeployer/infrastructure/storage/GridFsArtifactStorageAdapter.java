package fr.imt.pbdeployer.infrastructure.storage;

import com.mongodb.client.gridfs.model.GridFSFile;
import fr.imt.pbdeployer.business.port.ArtifactStoragePort;
import fr.imt.pbdeployer.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.gridfs.GridFsTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Release archives stored in GridFS, addressed by the hex id of their file document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GridFsArtifactStorageAdapter implements ArtifactStoragePort {

    private final GridFsTemplate gridFsTemplate;

    @Override
    public byte[] load(String artifactId) {
        if (artifactId == null || !ObjectId.isValid(artifactId)) {
            throw new ResourceNotFoundException("Artifact", String.valueOf(artifactId));
        }
        GridFSFile file = gridFsTemplate.findOne(Query.query(Criteria.where("_id").is(new ObjectId(artifactId))));
        if (file == null) {
            throw new ResourceNotFoundException("Artifact", artifactId);
        }
        try (InputStream content = gridFsTemplate.getResource(file).getInputStream()) {
            byte[] bytes = content.readAllBytes();
            log.debug("[ARTIFACT] Loaded {} ({} bytes)", file.getFilename(), bytes.length);
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read artifact " + artifactId, e);
        }
    }
}
