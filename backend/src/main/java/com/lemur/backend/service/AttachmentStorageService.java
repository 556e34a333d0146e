package com.lemur.backend.service;

import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.model.GridFSUploadOptions;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Base64;

/**
 * Screenshot attachments kept in GridFS and referenced from session turns by id.
 */
@Service
public class AttachmentStorageService {

    private static final String CONTENT_TYPE = "image/png";

    private final GridFSBucket gridFSBucket;

    public AttachmentStorageService(GridFSBucket gridFSBucket) {
        this.gridFSBucket = gridFSBucket;
    }

    /**
     * Store a base64 screenshot, optionally given as a {@code data:image/...;base64,} URI.
     *
     * @return GridFS file id
     */
    public String storeScreenshot(String sessionId, String base64Content) {
        byte[] data = Base64.getDecoder().decode(stripDataUri(base64Content));

        Document metadata = new Document();
        metadata.put("contentType", CONTENT_TYPE);
        metadata.put("sessionId", sessionId);

        GridFSUploadOptions options = new GridFSUploadOptions()
                .metadata(metadata);

        String filename = sessionId + "_" + Instant.now().toEpochMilli() + ".png";
        ObjectId fileId = gridFSBucket.uploadFromStream(filename, new ByteArrayInputStream(data), options);
        return fileId.toString();
    }

    /**
     * Load a stored screenshot back as plain base64.
     */
    public String loadBase64(String fileId) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        gridFSBucket.downloadToStream(new ObjectId(fileId), out);
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    static String stripDataUri(String content) {
        if (content.startsWith("data:image")) {
            int comma = content.indexOf(',');
            return comma >= 0 ? content.substring(comma + 1) : content;
        }
        return content;
    }
}
