package com.example.mmlogic.model;

public record PlayerProperty(String name, long value) {}
