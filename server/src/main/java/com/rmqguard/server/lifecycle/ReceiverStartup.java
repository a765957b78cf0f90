/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.rmqguard.server.lifecycle;

import com.rmqguard.common.model.ReceiversConfig;
import com.rmqguard.messaging.core.BrokerHost;
import com.rmqguard.messaging.receiver.ReceiversConnector;
import com.rmqguard.server.config.HandlerBinding;
import com.rmqguard.server.config.RmqGuardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects the configured subscriptions once the context is ready.
 *
 * <pre>
 * Phase 1: register handler bindings
 * Phase 2: connect subscriptions (first one installs the interceptor and the DLX)
 * Phase 3: start the consumer host
 * </pre>
 */
@Component
public class ReceiverStartup {

    private static final Logger log = LoggerFactory.getLogger(ReceiverStartup.class);

    private final RmqGuardProperties properties;
    private final BrokerHost host;
    private final ReceiversConnector receiversConnector;
    private final List<HandlerBinding> handlerBindings;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ReceiverStartup(RmqGuardProperties properties, BrokerHost host,
                           ReceiversConnector receiversConnector, ObjectProvider<HandlerBinding> handlerBindings) {
        this.properties = properties;
        this.host = host;
        this.receiversConnector = receiversConnector;
        this.handlerBindings = handlerBindings.orderedStream().toList();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!started.compareAndSet(false, true)) return;

        ReceiversConfig receivers = properties.getReceivers();
        if (receivers == null || receivers.getSubscriptions() == null || receivers.getSubscriptions().isEmpty()) {
            log.warn("No RabbitMQ subscriptions configured under rmqguard.receivers, consumer host not started");
            return;
        }

        for (HandlerBinding binding : handlerBindings) {
            host.registerHandler(binding.pattern(), binding.handler());
        }
        receiversConnector.connectAll(receivers);
        host.start();
        log.info("RabbitMQ receivers ready [subscriptions: {}, handlers: {}]",
                receivers.getSubscriptions().size(), handlerBindings.size());
    }

    public boolean isStarted() { return started.get(); }
}
