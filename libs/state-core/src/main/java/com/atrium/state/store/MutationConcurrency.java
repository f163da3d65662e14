package com.atrium.state.store;

/** What to do with a mutation on an id whose previous mutation has not resolved yet. */
public enum MutationConcurrency {

    /** Fail the second mutation with {@link ErrorKind#CONFLICT}. */
    REJECT,

    /** Hold the second mutation and dispatch it once the first commits or rolls back. */
    QUEUE
}
