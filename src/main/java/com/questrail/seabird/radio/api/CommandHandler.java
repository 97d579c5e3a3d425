package com.questrail.seabird.radio.api;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * CommandHandler
 * -----------------------------------------------------------------------------
 * A named capability contributed to the core.
 *
 * <p>Handlers are registered once at startup and never mutated. The router has
 * already checked the argument count against {@link #spec()} before
 * {@link #handle(CommandEnvelope)} is called.</p>
 *
 * <p>Handlers signal outcomes through the returned stage:</p>
 * <ul>
 *   <li>reply lines on success</li>
 *   <li>{@link CommandUsageException} for arguments the handler cannot accept</li>
 *   <li>upstream exceptions from {@code upstream} for data-source trouble</li>
 *   <li>anything else is treated as an internal failure</li>
 * </ul>
 */
public interface CommandHandler
{
    CommandSpec spec();

    CompletionStage<List<String>> handle(CommandEnvelope command);
}
