package de.bsommerfeld.feedengine.app;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.feedengine.app.config.AppModule;
import de.bsommerfeld.feedengine.core.config.ApplicationMode;
import de.bsommerfeld.feedengine.db.FeedRepository;

import java.util.Arrays;

/**
 * Command line entry point. Each invocation runs one {@link FeedService}
 * operation and prints its text result.
 *
 * <pre>
 * subscribe &lt;type&gt; &lt;identifier&gt;
 * unsubscribe &lt;type&gt; &lt;identifier&gt;
 * list
 * check
 * items [type] [limit]
 * search &lt;query...&gt;
 * </pre>
 *
 * A leading {@code --test} runs against the in-memory store.
 */
public final class FeedEngineMain {

    private FeedEngineMain() {
    }

    public static void main(String[] args) {
        if (args.length > 0 && "--test".equals(args[0])) {
            System.setProperty(ApplicationMode.PROPERTY, ApplicationMode.TEST.name());
            args = Arrays.copyOfRange(args, 1, args.length);
        }
        if (args.length == 0) {
            System.out.println(usage());
            return;
        }

        Injector injector = Guice.createInjector(new AppModule());
        FeedService service = injector.getInstance(FeedService.class);
        try {
            System.out.println(dispatch(service, args));
        } finally {
            injector.getInstance(FeedRepository.class).shutdown();
        }
    }

    static String dispatch(FeedService service, String[] args) {
        switch (args[0]) {
            case "subscribe":
                return args.length < 3 ? usage() : service.subscribe(args[1], args[2]);
            case "unsubscribe":
                return args.length < 3 ? usage() : service.unsubscribe(args[1], args[2]);
            case "list":
                return service.listSubscriptions();
            case "check":
                return service.checkFeeds();
            case "items":
                return service.getFeedItems(args.length > 1 ? args[1] : null,
                        args.length > 2 ? parseLimit(args[2]) : null);
            case "search":
                return args.length < 2 ? usage()
                        : service.searchFeeds(String.join(" ", Arrays.copyOfRange(args, 1, args.length)), null);
            default:
                return usage();
        }
    }

    private static Integer parseLimit(String value) {
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String usage() {
        return "Usage: feed-engine [--test] <command>\n"
                + "  subscribe <type> <identifier>\n"
                + "  unsubscribe <type> <identifier>\n"
                + "  list\n"
                + "  check\n"
                + "  items [type] [limit]\n"
                + "  search <query...>";
    }
}
