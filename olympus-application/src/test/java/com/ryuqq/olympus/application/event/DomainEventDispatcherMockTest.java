package com.ryuqq.olympus.application.event;

import com.ryuqq.olympus.core.event.EventHandler;
import com.ryuqq.olympus.core.model.Guid;
import com.ryuqq.olympus.core.spi.HandlerRegistry;
import com.ryuqq.olympus.testkit.fixture.SampleEvents.SampleCreated;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * DomainEventDispatcher와 HandlerRegistry 상호작용 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DomainEventDispatcherMockTest {

    @Mock
    private HandlerRegistry registry;

    @Mock
    private EventHandler<SampleCreated> first;

    @Mock
    private EventHandler<SampleCreated> second;

    private DomainEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new DomainEventDispatcher(registry, new DispatcherConfig());
    }

    @Test
    void bind_레지스트리에_위임됨() {
        // when
        dispatcher.bind(SampleCreated.class, first);

        // then
        verify(registry).bind(SampleCreated.class, first);
    }

    @Test
    void dispatch_이벤트의_런타임_클래스로_핸들러를_조회함() {
        // given
        SampleCreated event = SampleCreated.of(Guid.of("agg"), "name");
        when(registry.handlersFor(SampleCreated.class)).thenReturn(List.of(first, second));

        // when
        int invocations = dispatcher.dispatch(event);

        // then
        assertThat(invocations).isEqualTo(2);
        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).handle(event);
        inOrder.verify(second).handle(event);
    }

    @Test
    void dispatch_핸들러_예외시_남은_핸들러는_호출되지_않음() {
        // given
        SampleCreated event = SampleCreated.of(Guid.of("agg"), "name");
        when(registry.handlersFor(SampleCreated.class)).thenReturn(List.of(first, second));
        doThrow(new IllegalStateException("fail")).when(first).handle(event);

        // when & then
        assertThatThrownBy(() -> dispatcher.dispatch(event))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(second);
    }

    @Test
    void unbind_레지스트리_결과를_반환함() {
        // given
        when(registry.unbind(SampleCreated.class, first)).thenReturn(true);

        // when & then
        assertThat(dispatcher.unbind(SampleCreated.class, first)).isTrue();
        verify(registry).unbind(SampleCreated.class, first);
    }
}
