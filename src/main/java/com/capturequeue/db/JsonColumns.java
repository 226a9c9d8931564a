package com.capturequeue.db;

import com.capturequeue.core.JobMetadata;
import com.google.gson.Gson;
import com.google.gson.JsonSyntaxException;

// Gson encoding of the JSON text columns (embedding vectors, job metadata)
final class JsonColumns {
    private static final Gson gson = new Gson();

    private JsonColumns() {
    }

    static String vector(float[] vector) {
        return vector == null ? null : gson.toJson(vector);
    }

    static float[] vector(String json) {
        if (json == null || json.isEmpty()) {
            return null;
        }
        try {
            return gson.fromJson(json, float[].class);
        } catch (JsonSyntaxException e) {
            throw new IllegalStateException("Corrupt embedding column: " + abbreviate(json), e);
        }
    }

    static String metadata(JobMetadata metadata) {
        return gson.toJson(metadata != null ? metadata : new JobMetadata());
    }

    static JobMetadata metadata(String json) {
        if (json == null || json.isEmpty()) {
            return new JobMetadata();
        }
        try {
            JobMetadata metadata = gson.fromJson(json, JobMetadata.class);
            return metadata != null ? metadata : new JobMetadata();
        } catch (JsonSyntaxException e) {
            throw new IllegalStateException("Corrupt metadata column: " + abbreviate(json), e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() <= 60 ? json : json.substring(0, 60) + "...";
    }
}
