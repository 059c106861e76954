package warehouse.bridge.services;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Log sink for the <code>log</code> event bus address.
 *
 * <ul>
 *   <li>Buffers entries and appends them to <code>logs/current.csv</code> every few seconds.</li>
 *   <li>Rotates the file daily to a CSV named after the start of its block.</li>
 *   <li>Keeps the latest {@value #MAX_HISTORIC_FILES} rotated files.</li>
 *   <li>Flushes on <code>saveAllDataToFiles_OnTermination</code> during shutdown.</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

    public static final String FLUSH_ADDRESS = "saveAllDataToFiles_OnTermination";

    private static final long FLUSH_INTERVAL_MS = 5_000;
    private static final long ROTATE_INTERVAL_MS = 86_400_000L;
    private static final int MAX_HISTORIC_FILES = 12;
    private static final String HEADER = "Message,Level,Component,Operation,Category,SequenceReceived,EpochTimeMillis\n";
    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

    private final LinkedList<String> buffer = new LinkedList<>();
    private final String logsDir;
    private final String currentFile;
    private long sequenceCounter = 0;
    private long currentBlockStart;

    public Logger(String logsDir) {
        this.logsDir = logsDir;
        this.currentFile = logsDir + "/current.csv";
    }

    @Override
    public void start(Promise<Void> startPromise) {
        vertx.fileSystem().mkdirs(logsDir)
            .compose(v -> vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)))
            .onComplete(ar -> {
                if (ar.failed()) {
                    startPromise.fail(ar.cause());
                    return;
                }
                currentBlockStart = System.currentTimeMillis();
                setupConsumers();
                vertx.setPeriodic(FLUSH_INTERVAL_MS, id -> tick());
                startPromise.complete();
            });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        flushBuffer(ar -> stopPromise.complete());
    }

    private void setupConsumers() {
        vertx.eventBus().<String>consumer(LogUtil.LOG_ADDRESS, msg -> {
            sequenceCounter++;
            buffer.add(msg.body() + "," + sequenceCounter + "," + System.currentTimeMillis() + "\n");
        });
        vertx.eventBus().consumer(FLUSH_ADDRESS, msg -> flushBuffer(ar -> msg.reply(ar.succeeded())));
    }

    private void tick() {
        long now = System.currentTimeMillis();
        if (now - currentBlockStart >= ROTATE_INTERVAL_MS) {
            rotate(now, null);
        } else {
            flushBuffer(null);
        }
    }

    private void flushBuffer(Handler<AsyncResult<Void>> handler) {
        if (buffer.isEmpty()) {
            if (handler != null) {
                handler.handle(Future.succeededFuture());
            }
            return;
        }

        StringBuilder sb = new StringBuilder();
        buffer.forEach(sb::append);
        buffer.clear();

        vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true), openRes -> {
            if (openRes.failed()) {
                // the log file is the only sink; report on stderr instead
                System.err.println("Logger could not open " + currentFile + ": " + openRes.cause().getMessage());
                if (handler != null) {
                    handler.handle(openRes.mapEmpty());
                }
                return;
            }
            AsyncFile file = openRes.result();
            file.write(Buffer.buffer(sb.toString())).onComplete(wr -> {
                file.close();
                if (handler != null) {
                    handler.handle(wr.mapEmpty());
                }
            });
        });
    }

    private void rotate(long now, Handler<AsyncResult<Void>> after) {
        String rotatedPath = logsDir + "/" + FILE_STAMP.format(Instant.ofEpochMilli(currentBlockStart)) + ".csv";

        flushBuffer(flush -> {
            if (flush.failed()) {
                if (after != null) {
                    after.handle(flush);
                }
                return;
            }
            vertx.fileSystem().move(currentFile, rotatedPath)
                .compose(v -> {
                    currentBlockStart = now;
                    return vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER));
                })
                .onComplete(done -> {
                    if (done.succeeded()) {
                        cleanupOld();
                    }
                    if (after != null) {
                        after.handle(done);
                    }
                });
        });
    }

    private void cleanupOld() {
        vertx.fileSystem().readDir(logsDir, ".*\\.csv").onSuccess(files -> {
            List<String> history = files.stream()
                .filter(p -> !p.endsWith("current.csv"))
                .sorted()
                .collect(Collectors.toList());
            int excess = history.size() - MAX_HISTORIC_FILES;
            if (excess > 0) {
                history.subList(0, excess).forEach(p -> vertx.fileSystem().delete(p));
            }
        });
    }
}
