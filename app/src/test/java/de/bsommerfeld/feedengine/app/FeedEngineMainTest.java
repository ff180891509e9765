package de.bsommerfeld.feedengine.app;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedEngineMainTest {

    @Mock
    private FeedService service;

    @Test
    void dispatch_shouldRouteSubscribe() {
        when(service.subscribe("reddit", "rust")).thenReturn("ok");

        assertEquals("ok", FeedEngineMain.dispatch(service, new String[]{"subscribe", "reddit", "rust"}));
    }

    @Test
    void dispatch_shouldJoinSearchTerms() {
        when(service.searchFeeds("rust async runtime", null)).thenReturn("hits");

        assertEquals("hits", FeedEngineMain.dispatch(service, new String[]{"search", "rust", "async", "runtime"}));
    }

    @Test
    void dispatch_shouldPassItemsFilterAndLimit() {
        when(service.getFeedItems("news", 5)).thenReturn("items");

        assertEquals("items", FeedEngineMain.dispatch(service, new String[]{"items", "news", "5"}));
    }

    @Test
    void dispatch_shouldFallBackToDefaultLimitForBadNumber() {
        when(service.getFeedItems("news", null)).thenReturn("items");

        assertEquals("items", FeedEngineMain.dispatch(service, new String[]{"items", "news", "many"}));
    }

    @Test
    void dispatch_shouldShowUsageForMissingArguments() {
        assertEquals(FeedEngineMain.usage(), FeedEngineMain.dispatch(service, new String[]{"subscribe", "news"}));
        assertEquals(FeedEngineMain.usage(), FeedEngineMain.dispatch(service, new String[]{"search"}));
        assertEquals(FeedEngineMain.usage(), FeedEngineMain.dispatch(service, new String[]{"frobnicate"}));
        verifyNoInteractions(service);
    }

    @Test
    void dispatch_shouldRouteListAndCheck() {
        when(service.listSubscriptions()).thenReturn("subs");
        when(service.checkFeeds()).thenReturn("checked");

        assertEquals("subs", FeedEngineMain.dispatch(service, new String[]{"list"}));
        assertEquals("checked", FeedEngineMain.dispatch(service, new String[]{"check"}));
    }
}
