package com.example.ttrss;

import com.example.ttrss.client.TtrssException;
import com.example.ttrss.core.Settings;
import com.example.ttrss.model.FeedTreeNode;
import com.example.ttrss.model.SubscribeResult;
import com.example.ttrss.protocol.PredefinedIds;
import com.example.ttrss.tree.FeedTreeWalkException;
import com.example.ttrss.tree.FeedTreeWalker;
import com.example.ttrss.tree.VisitResult;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.Map;

public class Launcher {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, new FeedClient(), System.getenv(), System.out, System.err));
    }

    static int run(String[] args, FeedClient client, Map<String, String> env, PrintStream out, PrintStream err) {
        if (args.length < 4) {
            printUsage(err);
            return EXIT_USAGE;
        }
        String command = args[0];
        String hostUrl = args[1];
        String user = args[2];
        String password = args[3];
        if ("-".equals(password)) {
            password = env.get(Settings.PASSWORD_ENV);
            if (password == null) {
                err.println(Settings.PASSWORD_ENV + " is not set");
                return EXIT_USAGE;
            }
        }
        String[] rest = Arrays.copyOfRange(args, 4, args.length);

        try {
            switch (command) {
                case "tree":
                    return tree(client, hostUrl, user, password, rest, out, err);
                case "subscribe":
                    return subscribe(client, hostUrl, user, password, rest, out, err);
                default:
                    err.println("Unknown command: " + command);
                    printUsage(err);
                    return EXIT_USAGE;
            }
        } catch (TtrssException | FeedTreeWalkException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
    }

    private static int tree(FeedClient client, String hostUrl, String user, String password,
                            String[] rest, PrintStream out, PrintStream err)
            throws TtrssException, FeedTreeWalkException {
        boolean includeEmpty = false;
        for (String a : rest) {
            if ("--include-empty".equals(a)) {
                includeEmpty = true;
            } else {
                err.println("Unknown option: " + a);
                return EXIT_USAGE;
            }
        }

        client.login(hostUrl, user, password);
        FeedTreeNode root = client.fetchFeedTree(includeEmpty);

        Map<FeedTreeNode, Integer> depth = new IdentityHashMap<>();
        depth.put(root, 0);
        FeedTreeWalker.walk(root, node -> {
            int d = depth.getOrDefault(node, 0);
            for (FeedTreeNode child : node.children()) {
                depth.put(child, d + 1);
            }
            out.println("  ".repeat(d) + format(node));
            return VisitResult.CONTINUE;
        });
        return EXIT_OK;
    }

    private static int subscribe(FeedClient client, String hostUrl, String user, String password,
                                 String[] rest, PrintStream out, PrintStream err) throws TtrssException {
        if (rest.length < 1 || rest.length > 2) {
            printUsage(err);
            return EXIT_USAGE;
        }
        String feedUrl = rest[0];
        int categoryId = PredefinedIds.CATEGORY_UNCATEGORIZED;
        if (rest.length == 2) {
            try {
                categoryId = Integer.parseInt(rest[1]);
            } catch (NumberFormatException e) {
                err.println("Invalid category id: " + rest[1]);
                return EXIT_USAGE;
            }
        }

        client.login(hostUrl, user, password);
        SubscribeResult result = client.subscribe(feedUrl, categoryId);
        if (result.subscribed()) {
            out.println("Subscribed to " + feedUrl + " (" + result.outcome().code() + ")");
            return EXIT_OK;
        }
        err.println("Not subscribed: " + result.outcome().describe());
        return EXIT_FAILURE;
    }

    static String format(FeedTreeNode node) {
        if (node.isCategory()) {
            return node.name().equals(Settings.ROOT_NODE_NAME) && node.id() == Settings.ROOT_NODE_ID
                    ? node.name()
                    : node.name() + "/ [" + node.id() + "]";
        }
        String line = node.name() + " [" + node.id() + "]";
        if (node.hasError()) {
            line += " ! " + node.lastError();
        }
        return line;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage:");
        err.println("  tree <hostUrl> <user> <password|-> [--include-empty]");
        err.println("  subscribe <hostUrl> <user> <password|-> <feedUrl> [categoryId]");
        err.println("A password of '-' is read from " + Settings.PASSWORD_ENV + ".");
    }
}
