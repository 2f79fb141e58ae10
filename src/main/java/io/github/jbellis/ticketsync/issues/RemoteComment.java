package io.github.jbellis.ticketsync.issues;

public record RemoteComment(
        String author,
        String created,
        String body) {}
