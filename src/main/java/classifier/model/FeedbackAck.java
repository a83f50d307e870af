package classifier.model;

public record FeedbackAck(boolean success, String message, long feedbackId) {}
