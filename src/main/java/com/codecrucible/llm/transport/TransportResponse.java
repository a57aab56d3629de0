package com.codecrucible.llm.transport;

public class TransportResponse {

    private final int    statusCode;
    private final String body;

    public TransportResponse(int statusCode, String body) {
        this.statusCode = statusCode;
        this.body       = body != null ? body : "";
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return String.format("TransportResponse{status=%d, bodyLen=%d}", statusCode, body.length());
    }
}
