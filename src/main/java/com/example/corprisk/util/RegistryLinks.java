package com.example.corprisk.util;

import com.example.corprisk.config.RegistryProperties;
import org.springframework.stereotype.Component;

/**
 * Links to the public registry website for evidence items.
 */
@Component
public class RegistryLinks {

    private final String baseUrl;

    public RegistryLinks(RegistryProperties properties) {
        String url = properties.webBaseUrl() == null ? "" : properties.webBaseUrl().trim();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String company(String companyNumber) {
        return baseUrl + "/company/" + companyNumber;
    }

    public String officer(String officerId) {
        return baseUrl + "/officers/" + officerId + "/appointments";
    }
}
