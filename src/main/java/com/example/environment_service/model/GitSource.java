package com.example.environment_service.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GitSource {
    public static final String DEFAULT_BRANCH = "main";

    private String repositoryUrl;
    private String branch;

    public String effectiveBranch() {
        return branch == null || branch.isBlank() ? DEFAULT_BRANCH : branch;
    }
}
