package classifier.model;

/**
 * An uploaded image as the orchestrator sees it, detached from the servlet multipart API.
 */
public record PredictionUpload(String filename, String contentType, byte[] content, boolean rgpdConsent) {}
