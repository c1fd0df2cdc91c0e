package net.jrector.cli;

public enum PathType {
    AUTO,
    FILE,
    FOLDER
}
