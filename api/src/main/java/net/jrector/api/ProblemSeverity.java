package net.jrector.api;

public enum ProblemSeverity {
    WARNING,
    ERROR
}
