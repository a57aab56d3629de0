package com.codecrucible.controller.dto;

import java.util.List;

public class GenerationRequest {

    private String       prompt;
    private String       language;
    private List<String> features;

    public GenerationRequest() {
    }

    public GenerationRequest(String prompt, String language, List<String> features) {
        this.prompt   = prompt;
        this.language = language;
        this.features = features;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public List<String> getFeatures() {
        return features;
    }

    public void setFeatures(List<String> features) {
        this.features = features;
    }
}
