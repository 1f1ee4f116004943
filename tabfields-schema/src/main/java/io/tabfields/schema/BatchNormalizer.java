package io.tabfields.schema;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

/**
 * Encodes and decodes many rows of a {@link FieldSchema} in parallel.
 *
 * <h2>Execution</h2>
 *
 * <pre>{@code
 * rows ──► split into batches of batchSize ──► ForkJoinPool workers ──► results in row order
 * }</pre>
 *
 * <p>Fields never change after construction, so rows are independent and no
 * coordination between workers is needed beyond writing into disjoint result slots.
 * If any row fails, the exception raised for that row is rethrown to the caller and
 * no partial result is returned.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (BatchNormalizer batch = BatchNormalizer.builder(schema).parallelism(8).build()) {
 *     double[][] encoded = batch.normalizeRows(rows);
 *     List<Map<String, Object>> decoded = batch.denormalizeRows(encoded);
 * }
 * }</pre>
 */
public final class BatchNormalizer implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(BatchNormalizer.class);

    /** Default rows per parallel task */
    public static final int DEFAULT_BATCH_SIZE = 1024;

    /**
     * Returns the default parallelism level.
     *
     * @return the number of available processors
     */
    public static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private final FieldSchema schema;
    private final ForkJoinPool pool;
    private final int batchSize;
    private final boolean ownsPool;

    private BatchNormalizer(FieldSchema schema, ForkJoinPool pool, int batchSize, boolean ownsPool) {
        this.schema = schema;
        this.pool = pool;
        this.batchSize = batchSize;
        this.ownsPool = ownsPool;
    }

    /**
     * Creates a batch normalizer with default settings.
     *
     * @param schema the row schema
     * @return a batch normalizer owning its own pool
     */
    public static BatchNormalizer of(FieldSchema schema) {
        return builder(schema).build();
    }

    public static Builder builder(FieldSchema schema) {
        return new Builder(schema);
    }

    public FieldSchema schema() {
        return schema;
    }

    /**
     * Encodes rows in parallel.
     *
     * @param rows native rows keyed by field name
     * @return one encoded row of {@link FieldSchema#width()} slots per input row, in input order
     */
    public double[][] normalizeRows(List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        double[][] encoded = new double[rows.size()][];
        runBatches("normalize", rows.size(), (from, to) -> {
            for (int i = from; i < to; i++) {
                encoded[i] = schema.normalizeRow(rows.get(i));
            }
        });
        return encoded;
    }

    /**
     * Decodes rows in parallel.
     *
     * @param encoded encoded rows of {@link FieldSchema#width()} slots
     * @return one native row per encoded row, in input order
     */
    public List<Map<String, Object>> denormalizeRows(double[][] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        @SuppressWarnings("unchecked")
        Map<String, Object>[] decoded = new Map[encoded.length];
        runBatches("denormalize", encoded.length, (from, to) -> {
            for (int i = from; i < to; i++) {
                decoded[i] = schema.denormalizeRow(encoded[i]);
            }
        });
        return new ArrayList<>(Arrays.asList(decoded));
    }

    private void runBatches(String operation, int rowCount, RowRange task) {
        int numTasks = (rowCount + batchSize - 1) / batchSize;
        logger.debug("Starting {} of {} rows in {} batches (parallelism {})",
            operation, rowCount, numTasks, pool.getParallelism());

        List<Future<?>> futures = new ArrayList<>(numTasks);
        for (int taskIdx = 0; taskIdx < numTasks; taskIdx++) {
            int from = taskIdx * batchSize;
            int to = Math.min(from + batchSize, rowCount);
            futures.add(pool.submit(() -> task.run(from, to)));
        }

        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted during batch " + operation, e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                logger.debug("Batch {} failed: {}", operation, cause.getMessage());
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw new IllegalStateException("Batch " + operation + " failed", cause);
            }
        }
        logger.debug("Finished {} of {} rows", operation, rowCount);
    }

    /**
     * Shuts down the pool if this instance created it.
     */
    @Override
    public void close() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }

    @FunctionalInterface
    private interface RowRange {
        void run(int from, int to);
    }

    /**
     * Builder for custom BatchNormalizer configuration.
     */
    public static final class Builder {
        private final FieldSchema schema;
        private int parallelism = defaultParallelism();
        private int batchSize = DEFAULT_BATCH_SIZE;
        private ForkJoinPool pool = null;

        private Builder(FieldSchema schema) {
            this.schema = Objects.requireNonNull(schema, "schema cannot be null");
        }

        /**
         * Sets the number of worker threads of an owned pool.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Sets the number of rows per parallel task.
         */
        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive");
            }
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Uses an existing pool, which {@link BatchNormalizer#close()} leaves running.
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = pool;
            return this;
        }

        public BatchNormalizer build() {
            if (pool != null) {
                return new BatchNormalizer(schema, pool, batchSize, false);
            }
            return new BatchNormalizer(schema, new ForkJoinPool(parallelism), batchSize, true);
        }
    }
}
