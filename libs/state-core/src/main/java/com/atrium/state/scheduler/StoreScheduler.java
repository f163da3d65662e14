package com.atrium.state.scheduler;

import java.util.concurrent.Executor;

/**
 * The one logical thread all store state lives on.
 *
 * <p>Repository futures may complete on any thread; stores resume their continuations through this
 * executor, so cache reads and writes never race and stores need no locks. Callers must invoke
 * store operations from the scheduler's thread as well.
 */
public interface StoreScheduler extends Executor {
}
