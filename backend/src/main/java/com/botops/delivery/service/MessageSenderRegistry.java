package com.botops.delivery.service;

import com.botops.delivery.error.SenderConfigurationException;
import com.botops.scheduler.model.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Component
public class MessageSenderRegistry {

    private static final Logger log = LoggerFactory.getLogger(MessageSenderRegistry.class);

    private final Map<Channel, MessageSender> senders = new EnumMap<>(Channel.class);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public MessageSenderRegistry(List<MessageSender> discovered) {
        discovered.forEach(this::register);
    }

    public void register(MessageSender sender) {
        lock.writeLock().lock();
        try {
            MessageSender previous = senders.put(sender.channel(), sender);
            if (previous != null && previous != sender) {
                log.warn("Sender for channel {} is already registered. Overwriting {} with {}",
                        sender.channel().id(), previous.getClass().getSimpleName(), sender.getClass().getSimpleName());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public MessageSender getSender(Channel channel) {
        lock.readLock().lock();
        try {
            MessageSender sender = channel == null ? null : senders.get(channel);
            if (sender == null) {
                throw new SenderConfigurationException("No sender registered for channel: "
                        + (channel == null ? "null" : channel.id()));
            }
            return sender;
        } finally {
            lock.readLock().unlock();
        }
    }
}
