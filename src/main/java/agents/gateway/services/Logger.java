package agents.gateway.services;

import agents.gateway.config.GatewayConfig;
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

/**
 * Centralized logging service for the gateway.
 *
 * <p>Behaviour overview:</p>
 * <ul>
 *   <li>Collects CSV records published on the <code>log</code> address.</li>
 *   <li>Writes buffered records to <code>&lt;logDirectory&gt;/current.csv</code> every flush interval.</li>
 *   <li>After the rotate interval the file is renamed to a timestamped CSV (start time of
 *       the block) and a fresh <code>current.csv</code> is created.</li>
 *   <li>Only the latest rotated files are kept; older files are deleted automatically.</li>
 *   <li>Listens for <code>saveAllDataToFiles_OnTermination</code> to flush immediately on shutdown.</li>
 * </ul>
 */
public class Logger extends AbstractVerticle {

  public static final String LOG_ADDRESS = "log";
  public static final String FLUSH_ADDRESS = "saveAllDataToFiles_OnTermination";

  private static final String HEADER = "Message,Level,Component,Operation,Category,SequenceReceived,EpochTimeMillis\n";
  private static final DateTimeFormatter FILE_STAMP =
          DateTimeFormatter.ofPattern("yyyyMMdd_HHmm").withZone(ZoneId.of("UTC"));

  /* ---------- configuration ---------- */

  private final long flushIntervalMs;
  private final long rotateIntervalMs;
  private final int maxHistoricFiles;

  /* ---------- state ---------- */

  private final LinkedList<String> buffer = new LinkedList<>();
  private int sequenceCounter = 0;
  private long currentBlockStart;

  /* ---------- paths ---------- */

  private final String logsDir;
  private String currentFile;

  public Logger(GatewayConfig config) {
    this(config.getLogDirectory(), config.getLogFlushIntervalMs(), config.getLogRotateIntervalMs(), config.getLogMaxHistoricFiles());
  }

  public Logger(String logsDir, long flushIntervalMs, long rotateIntervalMs, int maxHistoricFiles) {
    this.logsDir = logsDir;
    this.flushIntervalMs = flushIntervalMs;
    this.rotateIntervalMs = rotateIntervalMs;
    this.maxHistoricFiles = maxHistoricFiles;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    currentFile = logsDir + "/current.csv";

    ensureDirectory().onComplete(ar -> {
      if (ar.failed()) {
        // Nowhere to log the failure to but the console
        System.err.println("Logger could not prepare " + logsDir + ": " + ar.cause().getMessage());
        startPromise.fail(ar.cause());
        return;
      }
      currentBlockStart = System.currentTimeMillis();
      setupConsumers();
      scheduleFlush();

      // Signal to Driver that logger is ready
      vertx.eventBus().publish("logger.ready", "true");
      startPromise.complete();
    });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    flushBuffer(ar -> stopPromise.complete());
  }

  /* ---------- initialisation ---------- */

  private Future<Void> ensureDirectory() {
    return vertx.fileSystem().mkdirs(logsDir)
        .compose(v -> vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER)));
  }

  private void setupConsumers() {
    vertx.eventBus().consumer(LOG_ADDRESS, msg -> {
      sequenceCounter++;
      long now = System.currentTimeMillis();
      buffer.add(msg.body() + "," + sequenceCounter + "," + now + "\n");
    });

    vertx.eventBus().consumer(FLUSH_ADDRESS, m -> flushBuffer(ar -> {
      if (m.replyAddress() != null) {
        m.reply(ar.succeeded());
      }
    }));
  }

  /* ---------- periodic tasks ---------- */

  private void scheduleFlush() {
    vertx.setPeriodic(flushIntervalMs, id -> {
      long now = System.currentTimeMillis();
      if (now - currentBlockStart >= rotateIntervalMs) {
        rotate(now, r -> flushBuffer(null));
      } else {
        flushBuffer(null);
      }
    });
  }

  /* ---------- flush / rotate ---------- */

  private void flushBuffer(Handler<AsyncResult<Void>> handler) {
    if (buffer.isEmpty()) {
      if (handler != null) handler.handle(Future.succeededFuture());
      return;
    }

    StringBuilder sb = new StringBuilder();
    buffer.forEach(sb::append);
    buffer.clear();

    vertx.fileSystem().open(currentFile, new OpenOptions().setAppend(true), openRes -> {
      if (openRes.succeeded()) {
        AsyncFile file = openRes.result();
        file.write(Buffer.buffer(sb.toString())).onComplete(wr -> {
          file.close();
          if (handler != null) handler.handle(wr.mapEmpty());
        });
      } else {
        if (handler != null) handler.handle(openRes.mapEmpty());
      }
    });
  }

  private void rotate(long now, Handler<AsyncResult<Void>> after) {
    String rotatedPath = logsDir + "/" + FILE_STAMP.format(Instant.ofEpochMilli(currentBlockStart)) + ".csv";

    // Flush first so nothing lands in the new block
    flushBuffer(flush -> {
      if (flush.failed()) {
        if (after != null) after.handle(flush);
        return;
      }
      vertx.fileSystem().move(currentFile, rotatedPath, mv -> {
        if (mv.succeeded()) {
          currentBlockStart = now;
          vertx.fileSystem().writeFile(currentFile, Buffer.buffer(HEADER), hdr -> {
            if (hdr.succeeded()) {
              cleanupOld();
            }
            if (after != null) after.handle(hdr.mapEmpty());
          });
        } else {
          if (after != null) after.handle(mv.mapEmpty());
        }
      });
    });
  }

  private void cleanupOld() {
    vertx.fileSystem().readDir(logsDir, ".*\\.csv", dir -> {
      if (dir.failed()) return;

      List<String> history = dir.result().stream()
              .filter(p -> !p.endsWith("current.csv"))
              .sorted()
              .toList();

      int excess = history.size() - maxHistoricFiles;
      if (excess > 0) {
        history.subList(0, excess).forEach(p -> vertx.fileSystem().delete(p));
      }
    });
  }
}
