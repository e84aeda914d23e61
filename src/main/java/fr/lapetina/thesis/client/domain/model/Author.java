package fr.lapetina.thesis.client.domain.model;

public record Author(String name, String id, boolean corresponding) {
}
