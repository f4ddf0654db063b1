package com.toolbox.jsformatter.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FormatResult(
        boolean success,
        String output,
        FormatStats stats,
        String error
) {

    public static FormatResult success(String output, FormatStats stats) {
        return new FormatResult(
                true,
                output,
                stats,
                null);
    }

    public static FormatResult failure(String error) {
        return new FormatResult(
                false,
                null,
                null,
                error);
    }
}
