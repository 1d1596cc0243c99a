package com.ordoAetheris.oncegate;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

public class OnceGateDemo {
        public static void main(String[] args) throws Exception {
            // =====================================================================
            // ЭМУЛЯЦИЯ ПРОДА: ленивая инициализация конфига при старте сервиса.
            //
            // Сюжет:
            // - Handlers: пул обработчиков запросов, все стартуют одновременно
            // - Каждому нужен конфиг, которого ещё нет (холодный старт)
            // - loadConfig: "дорогая" загрузка (диск/сеть), должна случиться ОДИН раз
            //
            // Ключевой эффект:
            // - loadConfig выполняется ровно один раз
            // - остальные handlers ЖДУТ на gate.execute(), а не видят пустой конфиг
            // =====================================================================

            int handlers = 16;
            int requestsPerHandler = 20;
            long loadMillis = 150;

            OnceGate gate = new OnceGate();

            // обычная HashMap: публикацию даёт gate (release-write после загрузки)
            Map<String, String> config = new HashMap<>();
            AtomicInteger loads = new AtomicInteger();

            Runnable loadConfig = () -> {
                loads.incrementAndGet();
                LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(loadMillis));
                config.put("db.url", "jdbc:postgresql://db:5432/app");
                config.put("pool.size", "32");
            };

            ExecutorService pool = Executors.newFixedThreadPool(handlers);
            CountDownLatch start = new CountDownLatch(1);

            AtomicInteger served = new AtomicInteger();
            AtomicInteger missingConfig = new AtomicInteger();
            AtomicLong maxBlockedMicros = new AtomicLong();

            // ---------------------------------------------------------------------
            // Handlers: каждый запрос сначала проходит через gate.
            // Первый запрос запускает загрузку, остальные ждут её окончания.
            // После Done все вызовы идут по fast path (без lock).
            // ---------------------------------------------------------------------
            for (int h = 0; h < handlers; h++) {
                final int handlerId = h;
                pool.submit(() -> {
                    await(start);
                    for (int i = 0; i < requestsPerHandler; i++) {
                        Instant t0 = Instant.now();
                        gate.execute(loadConfig);
                        long blockedMicros = Duration.between(t0, Instant.now()).toNanos() / 1_000;
                        maxBlockedMicros.accumulateAndGet(blockedMicros, Math::max);

                        if (i == 0 && blockedMicros > 1_000) {
                            System.out.printf("handler-%d: first request waited ~%dµs for config%n",
                                    handlerId, blockedMicros);
                        }

                        if (config.get("db.url") == null) missingConfig.incrementAndGet();
                        served.incrementAndGet();

                        microJitter();
                    }
                });
            }

            start.countDown();

            pool.shutdown();
            boolean finished = pool.awaitTermination(10, TimeUnit.SECONDS);

            if (!finished) {
                System.out.println("Pool didn't finish in time; calling shutdownNow()");
                pool.shutdownNow();
            }

            System.out.printf("%s loads=%d served=%d missingConfig=%d maxBlocked=%dµs%n",
                    gate, loads.get(), served.get(), missingConfig.get(), maxBlockedMicros.get());
        }

        private static void await(CountDownLatch latch) {
            try { latch.await(); } catch (InterruptedException e) { throw new RuntimeException(e); }
        }

        private static void microJitter() {
            // 1/64 вероятности — микропауза до 50µs
            if ((ThreadLocalRandom.current().nextInt() & 63) != 0) return;
            LockSupport.parkNanos(ThreadLocalRandom.current().nextInt(50_000));
        }
}
