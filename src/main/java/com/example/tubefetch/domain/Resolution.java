package com.example.tubefetch.domain;

public record Resolution(int width, int height) {

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
