package com.lob.engine.book;

/**
 * The book's internal bookkeeping disagrees with itself (crossed book,
 * aggregate quantity mismatch, index and levels out of step). This is a
 * defect, not a bad command: the engine that raised it stops processing.
 */
public final class BookInvariantException extends RuntimeException {

    public BookInvariantException(String message) {
        super(message);
    }
}
