package com.ureca.fanout.subscription.protocol;

import com.ureca.fanout.subscription.entity.Connection;
import com.ureca.fanout.support.fixture.SubscriberFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProtocolSelectorTest {

    @Test
    @DisplayName("레거시 플래그 -> subscriptions-transport-ws 어휘 (data)")
    void select_Legacy() {
        GraphQLProtocol protocol = ProtocolSelector.select(true);

        assertThat(protocol).isEqualTo(GraphQLProtocol.LEGACY);
        assertThat(protocol.getServerEventTypes().data()).isEqualTo("data");
        assertThat(protocol.getServerEventTypes().keepAlive()).isEqualTo("ka");
    }

    @Test
    @DisplayName("현행 플래그, 플래그 없음 -> graphql-ws 어휘 (next)")
    void select_Current() {
        assertThat(ProtocolSelector.select(false)).isEqualTo(GraphQLProtocol.GRAPHQL_TRANSPORT_WS);
        assertThat(ProtocolSelector.select(null)).isEqualTo(GraphQLProtocol.GRAPHQL_TRANSPORT_WS);
        assertThat(ProtocolSelector.select(null).getServerEventTypes().data()).isEqualTo("next");
    }

    @Test
    @DisplayName("연결 데이터가 없는 연결 -> 현행 프로토콜")
    void forConnection_NoData() {
        assertThat(ProtocolSelector.forConnection(new Connection("c-1", null)))
                .isEqualTo(GraphQLProtocol.GRAPHQL_TRANSPORT_WS);
        assertThat(ProtocolSelector.forConnection(SubscriberFixture.connection("c-2", true)))
                .isEqualTo(GraphQLProtocol.LEGACY);
    }
}
