package edu.pucmm.ferrovia.core;

import edu.pucmm.ferrovia.concurrent.BalancedDispatchPolicy;
import edu.pucmm.ferrovia.concurrent.DispatchPolicy;
import edu.pucmm.ferrovia.concurrent.SchedulerCore;
import edu.pucmm.ferrovia.concurrent.TrackDispatcher;
import edu.pucmm.ferrovia.concurrent.TrackEventBus;
import edu.pucmm.ferrovia.concurrent.TrackEventListener;
import edu.pucmm.ferrovia.concurrent.TrainTask;
import edu.pucmm.ferrovia.model.Train;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Motor de la simulación: lanza el despachador y un hilo por tren, espera a que
 * todos crucen y devuelve el orden de despacho.
 */
public class TrackSimulation {
    private static final Logger logger = Logger.getLogger(TrackSimulation.class.getName());

    private final List<Train> trains;
    private final SimulationConfig config;
    private final SchedulerCore core;
    private final TrackEventBus events = new TrackEventBus();
    private final ExecutorService executorService;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final List<Future<?>> tasks = new ArrayList<>();

    public TrackSimulation(List<Train> trains, SimulationConfig config) {
        this(trains, config, newWorkerPool(), new BalancedDispatchPolicy());
    }

    public TrackSimulation(List<Train> trains, SimulationConfig config,
                           ExecutorService executorService, DispatchPolicy policy) {
        this.trains = List.copyOf(trains);
        this.config = config;
        this.executorService = executorService;
        this.core = new SchedulerCore(this.trains, policy);
    }

    private static ExecutorService newWorkerPool() {
        final AtomicInteger threadCount = new AtomicInteger(0);
        return Executors.newCachedThreadPool(r -> {
            int n = threadCount.getAndIncrement();
            Thread t = new Thread(r);
            // cada tarea renombra su hilo con su papel
            t.setName("Ferrovia-" + n);
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(TrackEventListener listener) {
        events.addListener(listener);
    }

    public SchedulerCore getCore() {
        return core;
    }

    /**
     * Ejecuta la simulación completa y bloquea hasta que todos los trenes crucen.
     */
    public SimulationResult run() throws InterruptedException {
        try {
            return run(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new IllegalStateException("tiempo de espera ilimitado agotado", e);
        }
    }

    /**
     * Ejecuta la simulación con un límite de tiempo total.
     *
     * @throws TimeoutException      si no terminaron todos a tiempo; los hilos se cancelan
     * @throws WorkerStartException  si no se pudo lanzar algún hilo
     * @throws SimulationException   si algún hilo falló
     */
    public SimulationResult run(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("la simulación ya fue ejecutada");
        }
        logger.info("Simulación iniciada con " + trains.size() + " trenes (" + config + ")");

        SimulationClock clock = new SimulationClock(config.getTickMillis());
        CompletionService<Void> completions = new ExecutorCompletionService<>(executorService);
        startWorkers(completions, clock);

        long deadline = System.nanoTime() + Math.min(unit.toNanos(timeout), Long.MAX_VALUE / 2);
        try {
            // en orden de terminación: la primera falla se ve aunque el resto siga bloqueado
            for (int done = 0; done < tasks.size(); done++) {
                Future<Void> task = completions.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (task == null) {
                    throw new TimeoutException((tasks.size() - done) + " hilos sin terminar a tiempo");
                }
                task.get();
            }
        } catch (ExecutionException e) {
            abort();
            throw new SimulationException("Falló un hilo de la simulación", e.getCause());
        } catch (TimeoutException | InterruptedException e) {
            abort();
            throw e;
        }

        shutdown();
        SimulationResult result = new SimulationResult(core.getDispatchOrder(), clock.elapsedNanos(), core.getTrainsFinished());
        logger.info("Simulación terminada: " + result.trainsFinished() + " trenes en "
                + SimulationClock.formatElapsed(result.elapsedNanos()));
        return result;
    }

    private void startWorkers(CompletionService<Void> completions, SimulationClock clock) {
        try {
            tasks.add(completions.submit(new TrackDispatcher(core), null));
            for (Train train : trains) {
                tasks.add(completions.submit(new TrainTask(train, core, clock, events), null));
            }
            logger.fine("Lanzados " + tasks.size() + " hilos");
        } catch (RejectedExecutionException | OutOfMemoryError e) {
            logger.severe("No se pudo lanzar el hilo " + tasks.size() + ": " + e.getMessage());
            abort();
            throw new WorkerStartException("No se pudo lanzar el hilo " + tasks.size()
                    + " de " + (trains.size() + 1), e);
        }
    }

    /**
     * Cancela los hilos ya lanzados y espera su terminación.
     */
    public void abort() {
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
        executorService.shutdownNow();
        awaitTermination();
        logger.warning("Simulación abortada");
    }

    private void shutdown() {
        executorService.shutdown();
        awaitTermination();
    }

    private void awaitTermination() {
        try {
            if (!executorService.awaitTermination(config.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                logger.warning("Hilos sin terminar tras " + config.getShutdownTimeoutSeconds() + "s");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isStarted() {
        return started.get();
    }
}
