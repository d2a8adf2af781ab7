package com.example.tubefetch.web.dto;

public record CancelResponse(boolean ok) {

    public static CancelResponse acknowledged() {
        return new CancelResponse(true);
    }
}
