package agents.gateway.services;

import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

@ExtendWith(VertxExtension.class)
public class LoggerTest {

    @Test
    @DisplayName("Buffered records are written to current.csv when a flush is requested")
    void flushWritesCurrentFile(Vertx vertx, VertxTestContext testContext, @TempDir Path dir) {
        String logsDir = dir.toString();
        String currentFile = dir.resolve("current.csv").toString();

        vertx.deployVerticle(new Logger(logsDir, 600_000, 86_400_000L, 3))
            .compose(id -> {
                LogUtil.logInfo(vertx, "Gateway started, all good", "LoggerTest", "Flush", "Test");
                return vertx.eventBus().<Boolean>request(Logger.FLUSH_ADDRESS, "flush");
            })
            .compose(reply -> {
                Assertions.assertTrue(reply.body());
                return vertx.fileSystem().readFile(currentFile);
            })
            .onComplete(testContext.succeeding(contents -> testContext.verify(() -> {
                String[] lines = contents.toString().split("\n");
                Assertions.assertEquals(2, lines.length);
                Assertions.assertTrue(lines[0].startsWith("Message,Level,Component"));
                Assertions.assertTrue(lines[1].startsWith("Gateway started; all good,1,LoggerTest,Flush,Test,1,"));
                testContext.completeNow();
            })));
    }

    @Test
    @DisplayName("Messages are made safe for one CSV field")
    void formatStripsSeparators() {
        String line = LogUtil.formatLogMessage("a,b\nc", LogUtil.ERROR, "Comp", "Op", "Cat");

        Assertions.assertEquals("a;b c,0,Comp,Op,Cat", line);
    }
}
