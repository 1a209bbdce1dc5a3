package com.kotsin.advisor.feed;

public interface SentimentSource {

    /**
     * @return a score in [-100, 100]; 0 is neutral
     */
    double score(String pair);
}
