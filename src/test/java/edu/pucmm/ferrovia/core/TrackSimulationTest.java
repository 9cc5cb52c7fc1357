package edu.pucmm.ferrovia.core;

import edu.pucmm.ferrovia.concurrent.BalancedDispatchPolicy;
import edu.pucmm.ferrovia.concurrent.TrackEventListener;
import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainCategory;
import edu.pucmm.ferrovia.model.TrainState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Corridas completas con hilos reales y un reloj rápido.
 */
@Timeout(30)
class TrackSimulationTest {

    private static final SimulationConfig FAST = new SimulationConfig(2, Path.of("target/no-usado.txt"), 10);

    private static List<Train> randomRoster(int n, long seed) {
        Random random = new Random(seed);
        TrainCategory[] categories = TrainCategory.values();
        List<Train> trains = new ArrayList<>();
        for (int id = 0; id < n; id++) {
            trains.add(new Train(id, categories[random.nextInt(categories.length)],
                    1 + random.nextInt(6), 1 + random.nextInt(3)));
        }
        return trains;
    }

    /**
     * Cuenta trenes en la vía y registra el orden de los eventos de cada tren.
     */
    private static class TrackObserver implements TrackEventListener {
        final AtomicInteger onTrack = new AtomicInteger();
        final AtomicInteger maxOnTrack = new AtomicInteger();
        final Map<Integer, long[]> times = new ConcurrentHashMap<>();
        final List<Integer> entered = Collections.synchronizedList(new ArrayList<>());
        final Map<Integer, String> threadNames = new ConcurrentHashMap<>();

        @Override
        public void onReady(Train train, long elapsedNanos) {
            times.put(train.getId(), new long[]{elapsedNanos, -1, -1});
            threadNames.put(train.getId(), Thread.currentThread().getName());
        }

        @Override
        public void onEnterTrack(Train train, long elapsedNanos) {
            int now = onTrack.incrementAndGet();
            maxOnTrack.accumulateAndGet(now, Math::max);
            times.get(train.getId())[1] = elapsedNanos;
            entered.add(train.getId());
        }

        @Override
        public void onLeaveTrack(Train train, long elapsedNanos) {
            times.get(train.getId())[2] = elapsedNanos;
            onTrack.decrementAndGet();
        }
    }

    @Test
    @DisplayName("Todos los trenes cruzan y nunca hay dos en la vía a la vez")
    void testExclusionMutuaYVivacidad() throws Exception {
        List<Train> trains = randomRoster(15, 7L);
        TrackSimulation simulation = new TrackSimulation(trains, FAST);
        TrackObserver observer = new TrackObserver();
        simulation.addListener(observer);

        SimulationResult result = simulation.run(20, TimeUnit.SECONDS);

        assertEquals(15, result.trainsFinished());
        assertEquals(15, result.dispatchOrder().size());
        assertEquals(15, new HashSet<>(result.dispatchOrder()).size(), "cada tren cruza exactamente una vez");
        assertEquals(1, observer.maxOnTrack.get(), "nunca más de un tren en la vía");
        assertEquals(result.dispatchOrder(), observer.entered);

        for (Train train : trains) {
            long[] t = observer.times.get(train.getId());
            assertNotNull(t, "tren " + train.getId() + " sin eventos");
            assertTrue(t[0] <= t[1] && t[1] <= t[2], "eventos fuera de orden para tren " + train.getId());
            assertEquals(TrainState.DONE, train.getState());
            assertEquals(t[0], train.getReadyNanos());
            assertEquals("Tren-" + train.getId(), observer.threadNames.get(train.getId()));
        }
        assertTrue(simulation.getCore().isFinished());
        System.out.println("✅ orden de despacho: " + result.dispatchOrder());
    }

    @Test
    @DisplayName("Si un tren falla al cruzar, la simulación termina con SimulationException")
    void testFallaDeUnTren() {
        List<Train> trains = List.of(
                new Train(0, TrainCategory.EAST_HIGH, 1, 1),
                new Train(1, TrainCategory.WEST_LOW, 1, 1));
        TrackSimulation simulation = new TrackSimulation(trains, FAST);
        simulation.addListener(new TrackEventListener() {
            @Override
            public void onReady(Train train, long elapsedNanos) {
            }

            @Override
            public void onEnterTrack(Train train, long elapsedNanos) {
                throw new UncheckedIOException("disco lleno", new IOException("sin espacio"));
            }

            @Override
            public void onLeaveTrack(Train train, long elapsedNanos) {
            }
        });

        SimulationException e = assertThrows(SimulationException.class, () -> simulation.run(5, TimeUnit.SECONDS));
        assertInstanceOf(UncheckedIOException.class, e.getCause());
        assertTrue(simulation.isStarted());
    }

    @Test
    @DisplayName("Una lista vacía termina de inmediato")
    void testListaVacia() throws Exception {
        TrackSimulation simulation = new TrackSimulation(List.of(), FAST);
        SimulationResult result = simulation.run(5, TimeUnit.SECONDS);
        assertEquals(0, result.trainsFinished());
        assertTrue(result.dispatchOrder().isEmpty());
    }

    @Test
    @DisplayName("Si no se puede lanzar un hilo, se cancelan los ya lanzados")
    void testFalloAlLanzarHilos() {
        // solo caben el despachador y un tren
        ThreadPoolExecutor pool = new ThreadPoolExecutor(0, 2, 1, TimeUnit.SECONDS, new SynchronousQueue<>());
        List<Train> trains = List.of(
                new Train(0, TrainCategory.EAST_HIGH, 99, 1),
                new Train(1, TrainCategory.WEST_LOW, 99, 1),
                new Train(2, TrainCategory.WEST_HIGH, 99, 1));
        TrackSimulation simulation = new TrackSimulation(trains, FAST, pool, new BalancedDispatchPolicy());

        WorkerStartException e = assertThrows(WorkerStartException.class, () -> simulation.run(5, TimeUnit.SECONDS));
        assertNotNull(e.getCause());
        assertTrue(pool.isShutdown());
        assertTrue(pool.isTerminated(), "los hilos ya lanzados deben terminar");
        assertEquals(0, simulation.getCore().getTrainsFinished());
    }

    @Test
    @DisplayName("Con tiempo agotado se cancelan los hilos y se informa TimeoutException")
    void testTiempoAgotado() {
        List<Train> trains = List.of(
                new Train(0, TrainCategory.EAST_HIGH, 99, 99),
                new Train(1, TrainCategory.WEST_HIGH, 99, 99));
        TrackSimulation simulation = new TrackSimulation(trains,
                new SimulationConfig(20, Path.of("target/no-usado.txt"), 10));

        assertThrows(TimeoutException.class, () -> simulation.run(50, TimeUnit.MILLISECONDS));
        assertFalse(simulation.getCore().isFinished());
    }

    @Test
    @DisplayName("Una simulación no puede ejecutarse dos veces")
    void testSoloUnaEjecucion() throws Exception {
        TrackSimulation simulation = new TrackSimulation(List.of(new Train(0, TrainCategory.EAST_LOW, 1, 1)), FAST);
        simulation.run(5, TimeUnit.SECONDS);
        assertTrue(simulation.isStarted());
        assertThrows(IllegalStateException.class, simulation::run);
    }
}
