package com.jscst;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Parses independent units in parallel on a fixed thread pool.
 *
 * <p>Every unit gets its own {@link Parser}; only the read-only {@link ParserOptions} are
 * shared. A unit that is not done within the timeout is abandoned: its result is dropped
 * and its worker is left to finish, since a parse cannot be stopped part way through.</p>
 */
public class UnitParser implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(UnitParser.class.getName());

    private final ExecutorService executor;
    private final ParserOptions options;
    private final long timeoutMillis;

    /**
     * @param threads       worker threads
     * @param options       options for every unit
     * @param timeoutMillis how long to wait for each result once the previous one has been
     *                      collected, 0 to wait indefinitely
     */
    public UnitParser(int threads, ParserOptions options, long timeoutMillis) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeoutMillis must not be negative: " + timeoutMillis);
        }
        this.executor = Executors.newFixedThreadPool(threads);
        this.options = options;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Parse every unit and return the results in the iteration order of {@code units}.
     *
     * @param units unit name to source text
     */
    public List<UnitResult> parseAll(Map<String, String> units) throws InterruptedException {
        List<String> names = new ArrayList<>();
        List<Future<ParseResult>> futures = new ArrayList<>();
        for (Map.Entry<String, String> unit : units.entrySet()) {
            String source = unit.getValue();
            names.add(unit.getKey());
            futures.add(executor.submit(() -> new Parser(source, options).parse()));
        }

        List<UnitResult> results = new ArrayList<>(names.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(collect(names.get(i), futures.get(i)));
        }
        return results;
    }

    private UnitResult collect(String name, Future<ParseResult> future) throws InterruptedException {
        try {
            ParseResult result = timeoutMillis > 0
                ? future.get(timeoutMillis, TimeUnit.MILLISECONDS)
                : future.get();
            return UnitResult.parsed(name, result);
        } catch (TimeoutException e) {
            future.cancel(false);
            logger.warning("Abandoned " + name + " after " + timeoutMillis + "ms");
            return UnitResult.timedOut(name);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ParseException parseException) {
                logger.warning("Fatal error in " + name + ": " + parseException.getMessage());
                return UnitResult.fatal(name, parseException.diagnostic());
            }
            throw new IllegalStateException("Parsing " + name + " failed", e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
