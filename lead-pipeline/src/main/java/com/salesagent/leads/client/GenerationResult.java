package com.salesagent.leads.client;

public record GenerationResult(String text, String error) {

    public static GenerationResult ok(String text) {
        return new GenerationResult(text, null);
    }

    public static GenerationResult failed(String error) {
        return new GenerationResult(null, error);
    }

    public boolean isSuccess() {
        return error == null && text != null && !text.isBlank();
    }
}
