// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.util;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A trace message, intended to be used within try-with-resources.
 * <p>
 * Traces are <em>user-readable</em> descriptions of the operations in progress, such as "Parsing file foo.xml", shown
 * alongside a condition to tell where it happened. They're <em>not</em> meant to be a machine stack trace.
 * <p>
 * Trace objects should <em>never</em> be used outside the thread they were created by.
 */
public final class Trace implements AutoCloseable {
    /**
     * Initializes a new trace with the given <em>lazily evaluated</em> message and registers it as the newest active
     * trace of the calling thread.
     * <p>
     * The message supplier is called at most once.
     */
    public Trace(final MessageSupplier supplier) {
        final var context = localContext();
        next = context.firstTrace;
        this.supplier = supplier;
        ownerContext = context;
        context.firstTrace = this;
    }

    /**
     * Initializes a new trace with the given message and registers it as the newest active trace of the calling
     * thread.
     */
    public Trace(final String message) {
        this(() -> message);
    }

    /**
     * Returns the calling thread's active trace messages, starting with the most recently established one.
     */
    public static List<String> activeTraces() {
        final var result = new ArrayList<String>();
        for (var trace = localContext().firstTrace; trace != null; trace = trace.next) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Dummy method that does nothing, to silence compiler warnings about unreferenced auto-closeable resources.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Unregisters the trace from the current thread's trace chain.
     */
    @Override
    public void close() {
        assert ownerContext == localContext() : "Trace closed by a different thread";
        assert ownerContext.firstTrace == this : "Trace chain corrupt";
        ownerContext.firstTrace = next;
    }

    private String message() {
        var result = message;
        if (result == null) {
            result = supplier.get();
            message = result;
        }
        return result;
    }

    private static Context localContext() {
        return context.get();
    }

    @SuppressWarnings("nullness:type.argument") // Not actually nullable, CF doesn't understand withInitial.
    private static final ThreadLocal<Context> context = ThreadLocal.withInitial(Context::new);

    private final @Nullable Trace next;
    private final MessageSupplier supplier;
    private @Nullable String message = null;
    private final Context ownerContext;

    private static final class Context {
        private @Nullable Trace firstTrace = null;
    }
}
