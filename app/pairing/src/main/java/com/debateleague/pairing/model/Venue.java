package com.debateleague.pairing.model;

public record Venue(String name, EventFormat format) {}
