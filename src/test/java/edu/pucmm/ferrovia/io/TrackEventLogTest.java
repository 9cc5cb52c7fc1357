package edu.pucmm.ferrovia.io;

import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class TrackEventLogTest {

    private static final Pattern LINE = Pattern.compile(
            "\\d{2}:\\d{2}:\\d{2}\\.\\d Train [ \\d]\\d (is ready to go|is ON the main track going|is OFF the main track after going) (East|West)");

    @Test
    @DisplayName("Formato de las tres líneas de evento")
    void testFormatoDeLineas() {
        Train east = new Train(3, TrainCategory.EAST_HIGH, 1, 1);
        Train west = new Train(12, TrainCategory.WEST_LOW, 1, 1);

        assertEquals("00:00:01.2 Train  3 is ready to go East", TrackEventLog.readyLine(east, 1_234_000_000L));
        assertEquals("00:00:02.0 Train 12 is ON the main track going West", TrackEventLog.enterLine(west, 2_000_000_000L));
        assertEquals("00:01:00.5 Train  3 is OFF the main track after going East",
                TrackEventLog.leaveLine(east, 60_550_000_000L));
    }

    @Test
    @DisplayName("Escrituras concurrentes no mezclan líneas")
    void testEscriturasConcurrentes() throws Exception {
        StringWriter out = new StringWriter();
        TrackEventLog log = new TrackEventLog(out);
        int threads = 8;
        int linesPerThread = 200;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int i = 0; i < threads; i++) {
            Train train = new Train(i, i % 2 == 0 ? TrainCategory.EAST_LOW : TrainCategory.WEST_HIGH, 1, 1);
            new Thread(() -> {
                try {
                    start.await();
                    for (int j = 0; j < linesPerThread; j++) {
                        log.onReady(train, j * 1_000_000L);
                        log.onEnterTrack(train, j * 1_000_000L);
                        log.onLeaveTrack(train, j * 1_000_000L);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        log.close();

        String[] lines = out.toString().split("\n");
        assertEquals(threads * linesPerThread * 3, lines.length);
        for (String line : lines) {
            assertTrue(LINE.matcher(line).matches(), "línea mezclada: " + line);
        }
    }
}
