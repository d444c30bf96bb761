package com.deepknow.callbot.domain.agent;

public final class RetrievedDocument {
    private final String id;
    private final String title;
    private final String content;
    private final double score;

    public RetrievedDocument(String id, String title, String content, double score) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.score = score;
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public double getScore() { return score; }

    @Override
    public String toString() {
        return "RetrievedDocument{id='" + id + "', score=" + score + '}';
    }
}
