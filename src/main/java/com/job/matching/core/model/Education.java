package com.job.matching.core.model;

import java.util.List;

public record Education(
        String degree,
        String field,
        String institution,
        String graduationYear,
        String gpa,
        List<String> honors
) {
    public Education {
        honors = honors != null ? List.copyOf(honors) : List.of();
    }

    public static Education of(String degree, String field) {
        return new Education(degree, field, null, null, null, List.of());
    }
}
