package com.botops.delivery.service;

import com.botops.delivery.error.SenderConfigurationException;
import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.SendResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageSenderRegistryTest {

    @Test
    void resolvesSenderByChannel() {
        MessageSender telegram = sender(Channel.TELEGRAM);
        MessageSender discord = sender(Channel.DISCORD);

        MessageSenderRegistry registry = new MessageSenderRegistry(List.of(telegram, discord));

        assertThat(registry.getSender(Channel.TELEGRAM)).isSameAs(telegram);
        assertThat(registry.getSender(Channel.DISCORD)).isSameAs(discord);
    }

    @Test
    void laterRegistrationReplacesEarlier() {
        MessageSender first = sender(Channel.TELEGRAM);
        MessageSender second = sender(Channel.TELEGRAM);
        MessageSenderRegistry registry = new MessageSenderRegistry(List.of(first));

        registry.register(second);

        assertThat(registry.getSender(Channel.TELEGRAM)).isSameAs(second);
    }

    @Test
    void unknownChannelIsAConfigurationError() {
        MessageSenderRegistry registry = new MessageSenderRegistry(List.of(sender(Channel.TELEGRAM)));

        assertThatThrownBy(() -> registry.getSender(Channel.WHATSAPP))
                .isInstanceOf(SenderConfigurationException.class)
                .hasMessage("No sender registered for channel: whatsapp");
        assertThatThrownBy(() -> registry.getSender(null))
                .isInstanceOf(SenderConfigurationException.class);
    }

    private MessageSender sender(Channel channel) {
        return new MessageSender() {
            @Override
            public Channel channel() {
                return channel;
            }

            @Override
            public SendResult send(Job job) {
                return SendResult.completed();
            }
        };
    }
}
