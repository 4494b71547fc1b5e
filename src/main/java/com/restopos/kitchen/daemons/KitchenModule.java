package com.restopos.kitchen.daemons;

import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import com.restopos.kitchen.config.InMemorySystemConfiguration;
import com.restopos.kitchen.config.SchedulerConfig;
import com.restopos.kitchen.config.SystemConfiguration;
import com.restopos.kitchen.entities.kitchen.InMemoryKitchenTicketService;
import com.restopos.kitchen.entities.kitchen.KitchenTicketService;
import com.restopos.kitchen.store.IOrderStore;
import com.restopos.kitchen.store.InMemoryOrderStore;

import java.time.Clock;

/**
 * Wires the kitchen engine with the in process store, configuration and ticket service.
 */
public class KitchenModule extends AbstractModule {

    private final SchedulerConfig schedulerConfig;
    private final Clock clock;

    public KitchenModule(SchedulerConfig schedulerConfig, Clock clock) {
        this.schedulerConfig = schedulerConfig;
        this.clock = clock;
    }

    @Override protected void configure() {
        bind(SchedulerConfig.class).toInstance(schedulerConfig);
        bind(Clock.class).toInstance(clock);
        bind(IOrderStore.class).to(InMemoryOrderStore.class);
        bind(SystemConfiguration.class).to(InMemorySystemConfiguration.class);
        bind(KitchenTicketService.class).to(InMemoryKitchenTicketService.class);
        bindConstant().annotatedWith(Names.named("minDelayForReadyInSecs")).to(schedulerConfig.getMinDelayForReadyInSecs());
        bindConstant().annotatedWith(Names.named("maxDelayForReadyInSecs")).to(schedulerConfig.getMaxDelayForReadyInSecs());
    }
}
