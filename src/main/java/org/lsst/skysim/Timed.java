package org.lsst.skysim;

import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a piece of work and logs how long it took. The elapsed time in
 * milliseconds is appended to the message arguments, so a message such as
 * {@code "Rendered %d sources in %dms"} takes one argument of its own.
 *
 * @author tonyj
 */
public final class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    public static <T> T execute(Callable<T> callable, String message, Object... args) {
        return execute(DEFAULT_LOG_LEVEL, callable, message, args);
    }

    /**
     * Any exception thrown by the callable is rethrown unchanged, checked or
     * not.
     */
    public static <T> T execute(Level logLevel, Callable<T> callable, String message, Object... args) {
        long start = System.nanoTime();
        try {
            return callable.call();
        } catch (Exception x) {
            return Timed.sneakyThrow(x);
        } finally {
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Exception, R> R sneakyThrow(Exception t) throws T {
        throw (T) t;
    }

    private static Object[] append(Object[] args, Object arg) {
        Object[] result = new Object[args.length + 1];
        System.arraycopy(args, 0, result, 0, args.length);
        result[args.length] = arg;
        return result;
    }
}
