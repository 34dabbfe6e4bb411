package uk.ac.ntu.loopserve.server.db;

public record RunResult(int changes, long lastId) {}
