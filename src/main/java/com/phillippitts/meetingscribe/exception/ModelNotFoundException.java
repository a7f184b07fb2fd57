package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when a speech or diarization model file is missing at the configured path.
 * Backends throw it from their initialization step.
 */
public class ModelNotFoundException extends MeetingScribeException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
