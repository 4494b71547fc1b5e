package com.restopos.kitchen.daemons;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.restopos.kitchen.config.ConfigKey;
import com.restopos.kitchen.config.ConfigKeyMigration;
import com.restopos.kitchen.config.ConfigReader;
import com.restopos.kitchen.config.SchedulerConfig;
import com.restopos.kitchen.config.SchedulerConfigLoader;
import com.restopos.kitchen.entities.kitchen.InMemoryKitchenTicketService;
import com.restopos.kitchen.entities.kitchen.KitchenTicket;
import com.restopos.kitchen.entities.kitchen.observers.JsonEventPublisher;
import com.restopos.kitchen.entities.kitchen.observers.KitchenNotifier;
import com.restopos.kitchen.entities.orders.Order;
import com.restopos.kitchen.entities.orders.OrderLine;
import com.restopos.kitchen.intake.IntakeQuote;
import com.restopos.kitchen.intake.OrderIntakeService;
import com.restopos.kitchen.store.IOrderStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.PoissonDistribution;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Launches the kitchen engine together with a simulated kitchen floor. Configuration comes from kitchen_config.json in
 * the resources folder.
 * <p>
 * Reads the orders json file (file name is passed as the first argument, otherwise sample_orders.json from the resources
 * folder is used) and takes the orders through {@link OrderIntakeService} following a poisson distribution. When all
 * orders are taken and the floor had time to finish them, the daemons stop all background threads and exit.
 */
@Slf4j public class KitchenDaemons {

    private static final String SAMPLE_ORDERS_RESOURCE = "sample_orders.json";

    public static void main(String[] args) throws IOException, InterruptedException {
        SchedulerConfig config = SchedulerConfigLoader.fromClasspath(SchedulerConfigLoader.DEFAULT_RESOURCE);
        List<OrderInput> orderInputs;
        try (Reader reader = openOrders(args)) {
            orderInputs = getOrders(reader);
        }
        Injector injector = Guice.createInjector(new KitchenModule(config, Clock.systemDefaultZone()));
        launchKitchenDaemons(injector, config, orderInputs);
    }

    public static void launchKitchenDaemons(Injector injector, SchedulerConfig config, List<OrderInput> orderInputs)
        throws InterruptedException {
        prepareConfiguration(injector, config);

        Clock clock = injector.getInstance(Clock.class);
        injector.getInstance(KitchenNotifier.class).addObserver(new JsonEventPublisher(clock));
        KitchenFloorSimulator floorSimulator = injector.getInstance(KitchenFloorSimulator.class);
        SchedulerProcess schedulerProcess = injector.getInstance(SchedulerProcess.class);

        floorSimulator.startBackgroundActivities();
        schedulerProcess.start();

        List<String> orderIds = addOrdersWithPoissonDistribution(config, orderInputs.iterator(),
            injector.getInstance(OrderIntakeService.class), clock);

        // The last orders may still be waiting for a slot, give the floor a few rounds to finish them.
        Thread.sleep((config.getMaxDelayForReadyInSecs() * 2L + 2) * 1000 * 3);
        schedulerProcess.shutdown();
        floorSimulator.stopBackgroundActivities();

        logOrders(injector.getInstance(IOrderStore.class), orderIds);
        for (KitchenTicket ticket : injector.getInstance(InMemoryKitchenTicketService.class).getTickets()) {
            log.info("ticketInfo={}", ticket);
        }
        log.info("Scheduler status={}", schedulerProcess.status());
    }

    /**
     * Moves legacy configuration keys to their current names, and seeds the runtime configuration with the bootstrap
     * values where it has none.
     *
     * @param injector
     * @param config
     */
    private static void prepareConfiguration(Injector injector, SchedulerConfig config) {
        injector.getInstance(ConfigKeyMigration.class).migrate();
        ConfigReader configReader = injector.getInstance(ConfigReader.class);
        configReader.writeIntIfAbsent(ConfigKey.MaxConcurrentPreparations, config.getMaxConcurrentPreparations());
        configReader.writeIntIfAbsent(ConfigKey.TickIntervalSeconds, config.getTickIntervalSeconds());
        configReader.writeIntIfAbsent(ConfigKey.BasePreparationDurationMinutes, config.getBasePreparationDurationMinutes());
    }

    private static List<String> addOrdersWithPoissonDistribution(SchedulerConfig config, Iterator<OrderInput> inputItr,
        OrderIntakeService intakeService, Clock clock) throws InterruptedException {
        PoissonDistribution pd = new PoissonDistribution(config.getPoissonMeanPerSecond());
        List<String> orderIds = new ArrayList<>();
        while (inputItr.hasNext()) {
            int samples = pd.sample();
            for (int i = 0; i < samples && inputItr.hasNext(); i++) {
                Order order = toOrder(inputItr.next(), clock.instant());
                IntakeQuote quote = intakeService.accept(order);
                orderIds.add(order.getId());
                log.info("quote={}", quote);
            }
            // We are trying to achieve poisson mean per second. So lets sleep for a second, and then proceed
            // with the next batch.
            Thread.sleep(1000);
        }
        return orderIds;
    }

    private static Order toOrder(OrderInput orderInput, Instant now) {
        List<OrderLine> lines = new ArrayList<>();
        if (orderInput.getItems() != null) {
            for (OrderInput.ItemInput item : orderInput.getItems()) {
                lines.add(new OrderLine(item.getArticleId(), item.getName(), item.getQuantity(), item.getCustomization(), item.getNotes()));
            }
        }
        Instant requestedDeliveryTime =
            orderInput.getDeliveryInMinutes() == null ? null : now.plus(Duration.ofMinutes(orderInput.getDeliveryInMinutes()));
        return Order.builder().id(UUID.randomUUID().toString()).customerName(orderInput.getCustomerName()).createdAt(now)
            .requestedDeliveryTime(requestedDeliveryTime).estimatedDurationMinutes(orderInput.getEstimatedDurationMinutes())
            .autoPromote(orderInput.getAutoPromote()).lines(lines).notes(orderInput.getNotes()).build();
    }

    private static void logOrders(IOrderStore orderStore, List<String> orderIds) {
        for (String orderId : orderIds) {
            orderStore.findById(orderId).ifPresent(order -> log.info("orderInfo={}", order));
        }
    }

    private static Reader openOrders(String[] args) throws IOException {
        InputStream inputStream;
        if (args.length > 0) {
            inputStream = new FileInputStream(args[0]);
        } else {
            inputStream = KitchenDaemons.class.getClassLoader().getResourceAsStream(SAMPLE_ORDERS_RESOURCE);
            if (inputStream == null)
                throw new IOException("No " + SAMPLE_ORDERS_RESOURCE + " on the classpath");
        }
        return new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    /**
     * Given an orders json, converts it into OrderInput instances.
     *
     * @param reader
     * @return
     */
    static List<OrderInput> getOrders(Reader reader) {
        Gson gson = new Gson();
        Type type = new TypeToken<List<OrderInput>>() {
        }.getType();
        return gson.fromJson(reader, type);
    }
}
