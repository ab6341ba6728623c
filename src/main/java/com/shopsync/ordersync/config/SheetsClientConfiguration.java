package com.shopsync.ordersync.config;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.SheetsScopes;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.util.List;

@Configuration
public class SheetsClientConfiguration {

    @Value("${google.sheets.credentials-path}")
    private String credentialsPath;

    @Value("${google.sheets.application-name:Order Sync}")
    private String applicationName;

    /**
     * Service-account client for the ledger spreadsheet. {@code credentialsPath} accepts any Spring
     * resource location, e.g. {@code file:/etc/ordersync/sa.json}.
     */
    @Bean
    public Sheets sheets(ResourceLoader resourceLoader) throws IOException, GeneralSecurityException {
        GoogleCredentials credentials;
        try (InputStream in = resourceLoader.getResource(credentialsPath).getInputStream()) {
            credentials = GoogleCredentials.fromStream(in).createScoped(List.of(SheetsScopes.SPREADSHEETS));
        }
        return new Sheets.Builder(
                GoogleNetHttpTransport.newTrustedTransport(),
                GsonFactory.getDefaultInstance(),
                new HttpCredentialsAdapter(credentials))
                .setApplicationName(applicationName)
                .build();
    }
}
