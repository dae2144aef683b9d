package com.chatsync.client;

import com.chatsync.client.model.PushMessage;
import com.chatsync.core.channel.StorageStats;
import com.chatsync.core.config.ShareConfig;
import com.chatsync.core.error.ChatSyncException;
import com.chatsync.core.model.Message;
import com.chatsync.core.model.OnlineUser;
import com.chatsync.core.retention.SweepReport;
import com.chatsync.core.sync.ShareChatRoom;
import com.chatsync.core.sync.SyncClient;
import com.chatsync.core.sync.SyncListener;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@Slf4j
@Command(
        name = "chatsync",
        mixinStandardHelpOptions = true,
        description = "Chat over a WebSocket server or a shared directory / bucket",
        subcommands = {
                ChatClientApplication.PushCommand.class,
                ChatClientApplication.PullCommand.class,
                ChatClientApplication.SweepCommand.class,
                ChatClientApplication.StatsCommand.class
        }
)
public class ChatClientApplication implements Runnable {

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new ChatClientApplication()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    private static BufferedReader stdin() {
        return new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    }

    @Command(name = "push", description = "Join a WebSocket chat server")
    static final class PushCommand implements Callable<Integer> {

        @Option(names = {"--url"}, defaultValue = "ws://localhost:8765/ws")
        String url;

        @Option(names = {"--user"}, required = true, description = "User id, unique on the server")
        String userId;

        @Option(names = {"--name"}, description = "Display name (defaults to the user id)")
        String name;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            PushChatClient client;
            try {
                client = new PushChatClient(new URI(url), new ConsolePushListener(out));
            } catch (URISyntaxException e) {
                throw new ParameterException(spec.commandLine(), "Invalid --url: " + url);
            }

            if (!client.connectBlocking(10, TimeUnit.SECONDS)) {
                out.println("Could not connect to " + url);
                out.flush();
                return 1;
            }
            client.join(userId, name != null ? name : userId);
            out.println("Commands: /to <user> <text>, /ping, /quit");
            out.flush();

            try (BufferedReader in = stdin()) {
                String line;
                while ((line = in.readLine()) != null && client.isOpen()) {
                    line = line.trim();
                    if (line.isEmpty()) {
                        continue;
                    }
                    if (line.equals("/quit")) {
                        break;
                    }
                    try {
                        if (line.equals("/ping")) {
                            client.ping();
                        } else if (line.startsWith("/to ")) {
                            String[] parts = line.split("\\s+", 3);
                            if (parts.length < 3) {
                                out.println("Usage: /to <user> <text>");
                            } else {
                                client.sendPrivate(parts[1], parts[2]);
                            }
                        } else {
                            client.sendPublic(line);
                        }
                    } catch (IllegalStateException e) {
                        out.println(e.getMessage());
                    }
                    out.flush();
                }
            } finally {
                client.closeBlocking();
            }
            return 0;
        }
    }

    @Command(name = "pull", description = "Chat through a shared directory or bucket")
    static final class PullCommand implements Callable<Integer> {

        @Mixin
        StorageOptions storage;

        @Option(names = {"--user"}, required = true)
        String userId;

        @Option(names = {"--name"})
        String name;

        @Option(names = {"--downloads"}, description = "Where /get saves attachments", defaultValue = "downloads")
        Path downloads;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() throws IOException {
            PrintWriter out = spec.commandLine().getOut();
            ShareChatRoom room = ShareChatRoom.open(storage.toShareConfig());
            if (!room.getChannelStore().checkAccess()) {
                out.println("Shared storage is not writable: " + room.getStore().describe());
                out.flush();
                return 1;
            }

            ConsoleSyncListener listener = new ConsoleSyncListener(out);
            try (SyncClient client = room.newClient(userId, name, listener)) {
                client.start();
                out.println("Commands: /to <user> <text>, /file <path> [user], /get <n>, /users, /quit");
                out.flush();

                try (BufferedReader in = stdin()) {
                    String line;
                    while ((line = in.readLine()) != null) {
                        line = line.trim();
                        if (line.isEmpty()) {
                            continue;
                        }
                        if (line.equals("/quit")) {
                            break;
                        }
                        try {
                            handle(line, client, room, listener, out);
                        } catch (ChatSyncException | IllegalArgumentException e) {
                            out.println("Error: " + e.getMessage());
                        }
                        out.flush();
                    }
                }
            }
            return 0;
        }

        private void handle(String line, SyncClient client, ShareChatRoom room,
                            ConsoleSyncListener listener, PrintWriter out) {
            if (line.equals("/users")) {
                out.println("Online: " + client.onlineUsers().stream()
                        .map(OnlineUser::getUserId)
                        .collect(Collectors.joining(", ")));
            } else if (line.startsWith("/to ")) {
                String[] parts = line.split("\\s+", 3);
                if (parts.length < 3) {
                    out.println("Usage: /to <user> <text>");
                    return;
                }
                client.sendPrivate(parts[1], parts[2]);
            } else if (line.startsWith("/file ")) {
                String[] parts = line.split("\\s+", 3);
                Message sent = client.sendFile(Path.of(parts[1]), parts.length == 3 ? parts[2] : null);
                out.println("Sent " + sent.getAttachment().getOriginalName());
            } else if (line.startsWith("/get ")) {
                Message message = listener.attachment(Integer.parseInt(line.substring(5).trim()));
                if (message == null) {
                    out.println("No such attachment");
                    return;
                }
                Path saved = room.getAttachments().download(message.getAttachment(), downloads);
                out.println("Saved " + saved);
            } else {
                client.sendPublic(line);
            }
        }
    }

    @Command(name = "sweep", description = "Delete messages and heartbeats older than the retention window")
    static final class SweepCommand implements Callable<Integer> {

        @Mixin
        StorageOptions storage;

        @Option(names = {"--days"}, description = "Days to keep", defaultValue = "1")
        double days;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            if (days < 0) {
                throw new ParameterException(spec.commandLine(), "--days must not be negative");
            }
            PrintWriter out = spec.commandLine().getOut();
            ShareChatRoom room = ShareChatRoom.open(storage.toShareConfig());

            SweepReport report = room.getSweeper().sweepOlderThan(Duration.ofMinutes(Math.round(days * 24 * 60)));
            out.printf("Removed %d files older than %s (public=%d, private=%d, heartbeats=%d, directories=%d, failed=%d)%n",
                    report.getDeleted(), report.getCutoff(), report.getPublicDeleted(), report.getPrivateDeleted(),
                    report.getHeartbeatsDeleted(), report.getDirectoriesRemoved(), report.getFailed());
            out.flush();
            return report.getFailed() == 0 ? 0 : 1;
        }
    }

    @Command(name = "stats", description = "Count the files in a shared chat room")
    static final class StatsCommand implements Callable<Integer> {

        @Mixin
        StorageOptions storage;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            ShareConfig config = storage.toShareConfig();
            ShareChatRoom room = ShareChatRoom.open(config);

            StorageStats stats = room.getChannelStore().storageStats();
            Set<OnlineUser> online = room.getPresence().listOnline(room.getClock().instant(), config.getPresenceTtl());
            out.println("Storage:          " + room.getStore().describe());
            out.println("Public messages:  " + stats.getPublicMessages());
            out.println("Private messages: " + stats.getPrivateMessages());
            out.println("Heartbeats:       " + stats.getHeartbeats());
            out.println("Total files:      " + stats.getTotalFiles());
            out.println("Online users:     " + online.size());
            out.flush();
            return 0;
        }
    }

    static final class ConsolePushListener implements PushChatListener {

        private final PrintWriter out;

        ConsolePushListener(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onJoined(String message) {
            print("* " + message);
        }

        @Override
        public void onChat(PushMessage message) {
            print("[" + message.getTimestamp() + "] " + message.getUsername() + ": " + message.getMessage());
        }

        @Override
        public void onPrivateChat(PushMessage message) {
            print("[" + message.getTimestamp() + "] " + message.getUsername() + " -> "
                    + message.getTargetUserId() + ": " + message.getMessage());
        }

        @Override
        public void onPresenceChanged(String type, String userId, List<String> onlineUsers) {
            String verb = "user_joined".equals(type) ? "joined" : "left";
            print("* " + userId + " " + verb + " (online: " + String.join(", ", onlineUsers) + ")");
        }

        @Override
        public void onError(String message) {
            print("! " + message);
        }

        @Override
        public void onPong() {
            print("* pong");
        }

        @Override
        public void onDisconnected(String reason) {
            print("* disconnected" + (reason == null || reason.isEmpty() ? "" : ": " + reason));
        }

        private synchronized void print(String line) {
            out.println(line);
            out.flush();
        }
    }

    /**
     * Prints what the sync loop delivers and numbers attachments for {@code /get}.
     */
    static final class ConsoleSyncListener implements SyncListener {

        private final PrintWriter out;
        private final List<Message> attachments = new java.util.concurrent.CopyOnWriteArrayList<>();
        private volatile Set<OnlineUser> lastOnline = Set.of();

        ConsoleSyncListener(PrintWriter out) {
            this.out = out;
        }

        @Override
        public void onMessages(List<Message> messages) {
            for (Message message : messages) {
                StringBuilder line = new StringBuilder()
                        .append('[').append(message.getTimestamp()).append("] ")
                        .append(message.getSenderName());
                if (message.isPrivate()) {
                    line.append(" -> ").append(message.getTargetId());
                }
                line.append(": ").append(message.getBody());
                if (message.hasAttachment()) {
                    attachments.add(message);
                    line.append("  (/get ").append(attachments.size()).append(')');
                }
                print(line.toString());
            }
        }

        @Override
        public void onOnlineUsers(Set<OnlineUser> users) {
            if (!users.equals(lastOnline)) {
                lastOnline = users;
                print("* online: " + users.stream().map(OnlineUser::getUserId).collect(Collectors.joining(", ")));
            }
        }

        @Override
        public void onError(ChatSyncException error) {
            print("! " + error.getMessage());
        }

        Message attachment(int number) {
            return number >= 1 && number <= attachments.size() ? attachments.get(number - 1) : null;
        }

        private synchronized void print(String line) {
            out.println(line);
            out.flush();
        }
    }
}
