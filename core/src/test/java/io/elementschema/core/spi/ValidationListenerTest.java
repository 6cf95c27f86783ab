package io.elementschema.core.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementValue;
import io.elementschema.core.element.IntegerElement;
import io.elementschema.core.element.UnicodeElement;
import io.elementschema.core.mapping.Dict;
import io.elementschema.core.spi.ValidationListener.ValidatorEvent;
import io.elementschema.core.validation.LessThan;
import io.elementschema.core.validation.Present;
import io.elementschema.core.validation.ShorterThan;
import io.elementschema.core.validation.ValidationContext;
import io.elementschema.core.validation.Validator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

/** Tests for the {@link ValidationListener} SPI. */
@DisplayName("ValidationListener")
class ValidationListenerTest {

    private ListAppender<ILoggingEvent> logAppender;
    private Logger validatorLogger;

    @BeforeEach
    void setUp() {
        validatorLogger = (Logger) LoggerFactory.getLogger(Validator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        validatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        validatorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static ValidationContext contextWith(ValidationListener listener) {
        return ValidationContext.builder().name("profile").listener(listener).build();
    }

    @Test
    @DisplayName("One event per validator invocation")
    void oneEventPerValidator() {
        ValidationListener listener = mock(ValidationListener.class);
        Element<?> element = UnicodeElement.TYPE.validatedBy(new Present(), new ShorterThan(3)).create("abcd");

        element.validate(contextWith(listener));

        ArgumentCaptor<ValidatorEvent> captor = ArgumentCaptor.forClass(ValidatorEvent.class);
        verify(listener, times(2)).onValidated(captor.capture());
        List<ValidatorEvent> events = captor.getAllValues();

        assertThat(events).extracting(ValidatorEvent::validator).containsExactly("present", "shorter-than");
        assertThat(events).extracting(ValidatorEvent::passed).containsExactly(true, false);
        ValidatorEvent failed = events.get(1);
        assertThat(failed.elementType()).isEqualTo("UnicodeElement");
        assertThat(failed.contextName()).isEqualTo("profile");
        assertThat(failed.rawValue()).isEqualTo(ElementValue.of("abcd"));
        assertThat(failed.errors()).containsExactly("Must be shorter than 3.");
    }

    @Test
    @DisplayName("Events cover nested elements, children first")
    void nestedElementsEmitEvents() {
        List<ValidatorEvent> events = new ArrayList<>();
        Element<?> dict = Dict.of(UnicodeElement.TYPE, IntegerElement.TYPE.validatedBy(new LessThan(5)))
                .validatedBy(new Present())
                .create(Map.of("a", 1));

        dict.validate(contextWith(events::add));

        assertThat(events).extracting(ValidatorEvent::validator).containsExactly("less-than", "present");
        assertThat(events).extracting(ValidatorEvent::elementType).containsExactly("IntegerElement", "Dict");
    }

    @Test
    @DisplayName("Elements without validators emit nothing")
    void noValidatorsNoEvents() {
        ValidationListener listener = mock(ValidationListener.class);

        assertThat(UnicodeElement.TYPE.create("x").validate(contextWith(listener))).isTrue();
        verifyNoInteractions(listener);
    }

    @Test
    @DisplayName("Event errors are a snapshot")
    void eventErrorsAreCopied() {
        List<String> errors = new ArrayList<>(List.of("first"));
        ValidatorEvent event = new ValidatorEvent("v", "T", "n", ElementValue.unspecified(), false, errors);
        errors.add("second");

        assertThat(event.errors()).containsExactly("first");
        assertThat(new ValidatorEvent("v", "T", "n", ElementValue.unspecified(), true, null).errors()).isEmpty();
    }

    @Test
    @DisplayName("A failing listener does not break validation")
    void failingListenerIsLoggedAndIgnored() {
        ValidationListener listener = mock(ValidationListener.class);
        doThrow(new IllegalStateException("boom")).when(listener).onValidated(any());
        Element<?> element = UnicodeElement.TYPE.validatedBy(new ShorterThan(3), new Present()).create("abcd");

        assertThat(element.validate(contextWith(listener))).isFalse();

        verify(listener, times(2)).onValidated(any());
        assertThat(element.errors()).containsExactly("Must be shorter than 3.");
        assertThat(logAppender.list)
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .hasSize(2)
                .allSatisfy(e -> {
                    assertThat(e.getFormattedMessage()).isEqualTo("ValidationListener.onValidated failed");
                    assertThat(e.getThrowableProxy().getMessage()).isEqualTo("boom");
                });
    }
}
