package org.netpreserve.consolescan.consent;

import org.junit.jupiter.api.Test;
import org.netpreserve.consolescan.CancellationToken;
import org.netpreserve.consolescan.browser.PageDriver;
import org.netpreserve.consolescan.cdp.JavaScriptException;
import org.netpreserve.consolescan.cdp.protocol.CDPClosedException;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class ConsentHandlerTest {
    private final PageDriver page = mock(PageDriver.class);
    private final CancellationToken token = new CancellationToken();
    private final ConsentHandler acceptingHandler = new ConsentHandler(ConsentMode.ACCEPT, Duration.ofMillis(10));

    @Test
    void prefersTheVendorApi() throws Exception {
        when(page.eval(ConsentVendor.ONETRUST.detectScript())).thenReturn(true);

        ConsentOutcome outcome = acceptingHandler.handle(page, token, Duration.ofSeconds(5));

        assertEquals(new ConsentOutcome(ConsentOutcome.Phase.API, ConsentVendor.ONETRUST), outcome);
        assertTrue(outcome.accepted());
        verify(page).eval(ConsentVendor.ONETRUST.acceptScript());
        verify(page, never()).eval(ConsentVendor.COOKIEBOT.detectScript());
    }

    @Test
    void aVendorCheckThatThrowsMovesOnToTheNextVendor() throws Exception {
        when(page.eval(ConsentVendor.USERCENTRICS.detectScript()))
                .thenThrow(new JavaScriptException("TypeError: UC_UI.isInitialized is not a function"));
        when(page.eval(ConsentVendor.ONETRUST.detectScript())).thenReturn(true);

        ConsentOutcome outcome = acceptingHandler.handle(page, token, Duration.ofSeconds(5));

        assertEquals(new ConsentOutcome(ConsentOutcome.Phase.API, ConsentVendor.ONETRUST), outcome);
        verify(page).eval(ConsentVendor.ONETRUST.acceptScript());
    }

    @Test
    void clicksAnAcceptButtonWhenNoApiIsLoaded() throws Exception {
        when(page.eval(argThat(script -> script.contains("element.click()"))))
                .thenReturn("#CybotCookiebotDialogBodyButtonAccept");

        ConsentOutcome outcome = acceptingHandler.handle(page, token, Duration.ofSeconds(5));

        assertEquals(ConsentOutcome.Phase.CLICK, outcome.phase());
        assertEquals(ConsentVendor.COOKIEBOT, outcome.vendor());
    }

    @Test
    void hidesBannersAsALastResort() throws Exception {
        when(page.eval(argThat(script -> script.contains("style.display = 'none'")))).thenReturn(2);

        ConsentOutcome outcome = acceptingHandler.handle(page, token, Duration.ofSeconds(5));

        assertEquals(ConsentOutcome.Phase.HIDE, outcome.phase());
        assertFalse(outcome.accepted());
    }

    @Test
    void hideOnlyModeNeverAccepts() throws Exception {
        var handler = new ConsentHandler(ConsentMode.HIDE_ONLY, Duration.ZERO);

        assertEquals(ConsentOutcome.NONE, handler.handle(page, token, Duration.ofSeconds(5)));
        verify(page, times(1)).eval(anyString());
        verify(page, never()).eval(ConsentVendor.USERCENTRICS.detectScript());
    }

    @Test
    void scriptErrorsAreNotFatal() throws Exception {
        when(page.eval(anyString())).thenThrow(new JavaScriptException("TypeError: nope"));

        assertEquals(ConsentOutcome.NONE, acceptingHandler.handle(page, token, Duration.ofSeconds(5)));
    }

    @Test
    void aLostConnectionIsPassedOn() {
        when(page.eval(anyString())).thenThrow(new CDPClosedException());

        assertThrows(CDPClosedException.class, () -> acceptingHandler.handle(page, token, Duration.ofSeconds(5)));
    }

    @Test
    void selectorsAreEmbeddedAsJsonStrings() {
        String script = ConsentHandler.clickScript(List.of("button[class*=\"accept\"]", "#it's"));
        assertTrue(script.contains("[\"button[class*=\\\"accept\\\"]\",\"#it's\"]"), script);
    }
}
