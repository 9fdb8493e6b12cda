package com.jreinhal.norma.reasoning;

public record DomainConflict(String domainA, String hypothesisA, String domainB, String hypothesisB, String description) {
}
