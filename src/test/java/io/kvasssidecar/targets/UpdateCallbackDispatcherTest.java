package io.kvasssidecar.targets;

import io.kvasssidecar.enums.TargetState;
import io.kvasssidecar.models.Target;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateCallbackDispatcherTest {

    @Mock
    private TargetsUpdateCallback first;

    @Mock
    private TargetsUpdateCallback second;

    @Mock
    private TargetsUpdateCallback third;

    private UpdateCallbackDispatcher dispatcher;
    private final Map<String, List<Target>> targets = Map.of("job1", List.of(new Target(1L, 10L, TargetState.NORMAL)));

    @BeforeEach
    void setUp() {
        dispatcher = new UpdateCallbackDispatcher();
    }

    @Test
    void testCallbacksRunInRegistrationOrder() throws Exception {
        dispatcher.register(first, second);
        dispatcher.register(third);

        dispatcher.dispatch(targets);

        InOrder inOrder = inOrder(first, second, third);
        inOrder.verify(first).onTargetsUpdated(targets);
        inOrder.verify(second).onTargetsUpdated(targets);
        inOrder.verify(third).onTargetsUpdated(targets);
        verifyNoMoreInteractions(first, second, third);
    }

    @Test
    void testFirstFailureStopsDispatch() throws Exception {
        IllegalStateException failure = new IllegalStateException("config reload failed");
        doThrow(failure).when(first).onTargetsUpdated(any());
        dispatcher.register(first, second);

        assertThatThrownBy(() -> dispatcher.dispatch(targets))
            .isInstanceOf(TargetsUpdateException.class)
            .hasCause(failure)
            .satisfies(e -> assertThat(((TargetsUpdateException) e).getStage())
                .isEqualTo(TargetsUpdateException.Stage.CALLBACK));
        verify(second, never()).onTargetsUpdated(any());
    }

    @Test
    void testCheckedCallbackFailureIsWrapped() throws Exception {
        Exception failure = new Exception("write prometheus config");
        doThrow(failure).when(second).onTargetsUpdated(any());
        dispatcher.register(first, second, third);

        assertThatThrownBy(() -> dispatcher.dispatch(targets)).hasCause(failure);
        verify(first).onTargetsUpdated(targets);
        verify(third, never()).onTargetsUpdated(any());
    }

    @Test
    void testNoCallbacks() {
        assertThatCode(() -> dispatcher.dispatch(targets)).doesNotThrowAnyException();
    }
}
