package com.chooserich.web.model;

public record ErrorResponse(String error, String code) {

    public ErrorResponse(String error) {
        this(error, null);
    }
}
