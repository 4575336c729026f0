package com.carelogs.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One home-care visit as read from an uploaded batch file.
 *
 * Absent text fields are normalized to "" except {@code client}, which stays null so each
 * pipeline can apply its own default (see {@link #clientOr(String)}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisitRecord(
        @JsonProperty("note") String note,
        @JsonProperty("client") String client,
        @JsonProperty("care_pro") String carePro,
        @JsonProperty("visit_date") String visitDate,
        @JsonProperty("classification") String classification) {

    public VisitRecord {
        note = note == null ? "" : note;
        carePro = carePro == null ? "" : carePro;
        visitDate = visitDate == null ? "" : visitDate;
    }

    public boolean hasUsableNote() {
        return !note.isBlank();
    }

    public String clientOr(String fallback) {
        return client == null ? fallback : client;
    }
}
