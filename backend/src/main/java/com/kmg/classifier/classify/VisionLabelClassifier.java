package com.kmg.classifier.classify;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.rpc.ApiException;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.vision.v1.*;
import com.google.protobuf.ByteString;
import com.kmg.classifier.config.ClassifierProperties;
import com.kmg.classifier.model.Classification;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies images with Cloud Vision label detection. When a candidate label set is configured, only
 * annotations naming one of those classes count; everything else the model sees is ignored.
 */
@Service
public class VisionLabelClassifier implements ImageClassifier {
    private static final Logger log = LoggerFactory.getLogger(VisionLabelClassifier.class);

    private final ClassifierProperties.Vision settings;
    private final Map<String, String> candidateLabels;
    private ImageAnnotatorClient client;

    public VisionLabelClassifier(ClassifierProperties properties) {
        this.settings = properties.getVision();
        this.candidateLabels = indexLabels(settings.getLabels());
    }

    @Override
    public Classification classify(byte[] image) {
        try {
            AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                    .setImage(Image.newBuilder().setContent(ByteString.copyFrom(image)).build())
                    .addFeatures(Feature.newBuilder()
                            .setType(Feature.Type.LABEL_DETECTION)
                            .setMaxResults(settings.getMaxResults())
                            .build())
                    .build();

            BatchAnnotateImagesResponse batchResponse = getOrCreateClient().batchAnnotateImages(List.of(request));
            AnnotateImageResponse response = batchResponse.getResponses(0);
            if (response.hasError()) {
                throw new ClassificationException(response.getError().getMessage());
            }
            return toClassification(response.getLabelAnnotationsList());
        } catch (ClassificationException e) {
            throw e;
        } catch (ApiException e) {
            throw new ClassificationException("Vision API call failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ClassificationException("Failed to create Vision client: " + e.getMessage(), e);
        }
    }

    Classification toClassification(List<EntityAnnotation> annotations) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (EntityAnnotation annotation : annotations) {
            String label = normalizeLabel(annotation.getDescription());
            if (label == null) {
                continue;
            }
            double score = Math.max(0.0, Math.min(1.0, annotation.getScore()));
            scores.merge(label, score, Math::max);
        }

        if (scores.isEmpty()) {
            throw new ClassificationException(candidateLabels.isEmpty()
                    ? "No labels detected in image"
                    : "None of the known classes were detected in image");
        }

        Map.Entry<String, Double> best = scores.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElseThrow();
        return new Classification(best.getKey(), best.getValue(), scores, settings.getModelVersion());
    }

    private String normalizeLabel(String description) {
        if (description == null || description.isBlank()) {
            return null;
        }
        if (candidateLabels.isEmpty()) {
            return description.trim();
        }
        return candidateLabels.get(description.trim().toLowerCase(Locale.ROOT));
    }

    private static Map<String, String> indexLabels(List<String> labels) {
        Map<String, String> index = new HashMap<>();
        if (labels == null) {
            return index;
        }
        for (String label : labels) {
            if (label != null && !label.isBlank()) {
                index.put(label.trim().toLowerCase(Locale.ROOT), label.trim());
            }
        }
        return index;
    }

    private synchronized ImageAnnotatorClient getOrCreateClient() throws IOException {
        if (client != null) {
            return client;
        }

        String credentialPath = settings.getCredentialPath();
        if (credentialPath == null || credentialPath.isBlank()) {
            log.info("Creating Vision client with application default credentials");
            client = ImageAnnotatorClient.create();
            return client;
        }

        GoogleCredentials credentials;
        try (InputStream in = Files.newInputStream(Path.of(credentialPath))) {
            credentials = ServiceAccountCredentials.fromStream(in);
        }
        ImageAnnotatorSettings clientSettings = ImageAnnotatorSettings.newBuilder()
                .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                .build();
        log.info("Creating Vision client from {}", credentialPath);
        client = ImageAnnotatorClient.create(clientSettings);
        return client;
    }

    @PreDestroy
    public synchronized void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
