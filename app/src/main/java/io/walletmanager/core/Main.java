package io.walletmanager.core;

import io.walletmanager.core.account.AccountProxy;
import io.walletmanager.core.account.BaseAccount;
import io.walletmanager.core.account.InMemoryAccountDirectory;
import io.walletmanager.core.catalog.FeatureSet;
import io.walletmanager.core.lock.LockStorage;
import io.walletmanager.core.manager.ManagerConfig;
import io.walletmanager.core.manager.VersionManager;
import io.walletmanager.core.metrics.ManagerMetrics;
import io.walletmanager.core.module.InMemoryModuleRegistry;
import io.walletmanager.core.module.Module;
import io.walletmanager.core.protocol.Address;
import io.walletmanager.core.protocol.RejectionException;
import io.walletmanager.core.rpc.RpcServer;
import io.walletmanager.core.upgrade.UpgradeReport;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        ManagerConfig config = options.configFile() != null
                ? ManagerConfig.load(options.configFile())
                : ManagerConfig.defaultLocal();

        InMemoryModuleRegistry registry = new InMemoryModuleRegistry();
        for (Address module : config.moduleAddresses()) {
            registry.register(Module.ofAddress(module));
        }
        InMemoryAccountDirectory accounts = new InMemoryAccountDirectory();
        for (ManagerConfig.AccountSpec spec : config.accounts) {
            BaseAccount account = new BaseAccount(spec.address, spec.owner);
            account.credit(spec.balance);
            accounts.register(account);
        }
        LockStorage lockStorage = new LockStorage(config.lockStorage);

        VersionManager manager;
        if (options.inMemory()) {
            manager = VersionManager.inMemory(registry, accounts, lockStorage, accounts, config.catalogOwner);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            Files.createDirectories(dataPath);
            manager = VersionManager.rocks(dataPath.toString(), registry, accounts, lockStorage, accounts, config.catalogOwner);
        }

        RpcServer rpcServer = null;
        try {
            manager.attachStorage(config.catalogOwner, lockStorage);
            publishFeatureSets(manager, config);
            LOG.info("Catalog owner=" + config.catalogOwner + ", last version=" + manager.lastVersion());

            if (options.demo()) {
                runDemoFlow(manager, accounts, lockStorage);
            } else {
                LOG.info("Demo flow disabled (--no-demo)");
            }

            if (options.enableRpc()) {
                rpcServer = new RpcServer(manager, options.rpcBind(), options.rpcPort(), options.rpcToken());
                rpcServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "wallet-vm-shutdown"));
                LOG.info("Manager running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (rpcServer != null) {
                rpcServer.stop();
            }
            manager.close();
        }
    }

    /** Appends the configured feature sets the catalog does not hold yet. */
    static int publishFeatureSets(VersionManager manager, ManagerConfig config) {
        int published = 0;
        for (int i = (int) manager.lastVersion(); i < config.featureSets.size(); i++) {
            ManagerConfig.FeatureSetSpec spec = config.featureSets.get(i);
            long version = manager.addFeatureSet(config.catalogOwner, spec.features, spec.toInitialize);
            LOG.info("Published feature set v" + version + " with " + spec.features.size() + " modules");
            published++;
        }
        return published;
    }

    private static void runDemoFlow(VersionManager manager, InMemoryAccountDirectory accounts, LockStorage lockStorage) {
        long latest = manager.lastVersion();
        if (latest == 0) {
            LOG.info("No feature sets published, skipping demo");
            return;
        }
        FeatureSet head = manager.getFeatureSet(latest).orElseThrow();
        Address operator = head.features().get(0);

        for (AccountProxy account : accounts.list()) {
            if (manager.account(account.address()).isVersioned()) {
                LOG.info(account.address() + " already on v" + manager.account(account.address()).currentVersion());
                continue;
            }
            UpgradeReport report = manager.upgradeAccount(account.address(), latest, account.owner());
            LOG.info("Upgraded " + report);
        }

        accounts.list().stream().findFirst().ifPresent(account -> {
            long until = Instant.now().getEpochSecond() + 3_600;
            manager.invokeStorage(account.address(), lockStorage.address(),
                    LockStorage.setLockCall(account.address(), until), operator);
            LOG.info("Locked " + account.address() + " until " + until + " via " + operator);
            try {
                manager.upgradeAccount(account.address(), latest, account.owner());
            } catch (RejectionException e) {
                LOG.info("Upgrade while locked rejected as expected: " + e.reason().code());
            }
            manager.invokeStorage(account.address(), lockStorage.address(),
                    LockStorage.setLockCall(account.address(), 0), operator);
            LOG.info("Unlocked " + account.address());
        });

        for (AccountProxy account : accounts.list()) {
            LOG.info(manager.account(account.address()).toString());
        }
        LOG.info("=== Metrics ===\n" + ManagerMetrics.scrapeMetrics());
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            Path configFile,
            boolean inMemory,
            boolean keepAlive,
            boolean demo,
            boolean enableRpc,
            String rpcBind,
            int rpcPort,
            String rpcToken
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("WALLET_VM_DATA_DIR", Path.of("./data/manager"));
            Path configFile = envPath("WALLET_VM_CONFIG", null);
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("WALLET_VM_IN_MEMORY"));
            boolean keepAlive = false;
            boolean demo = true;
            boolean enableRpc = "true".equalsIgnoreCase(System.getenv("WALLET_VM_ENABLE_RPC"));
            String rpcBind = envOrDefault("WALLET_VM_RPC_BIND", "127.0.0.1");
            int rpcPort = 9090;
            String rpcToken = System.getenv("WALLET_VM_RPC_TOKEN");
            boolean showHelp = false;
            String error = null;

            try {
                rpcPort = envPort("WALLET_VM_RPC_PORT", 9090);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.equals("--enable-rpc")) {
                        enableRpc = true;
                    } else if (arg.startsWith("--rpc-bind=")) {
                        rpcBind = arg.substring("--rpc-bind=".length());
                    } else if (arg.startsWith("--rpc-port=")) {
                        try {
                            rpcPort = parsePort(arg.substring("--rpc-port=".length()), "--rpc-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--rpc-token=")) {
                        rpcToken = arg.substring("--rpc-token=".length());
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (rpcToken == null || rpcToken.isBlank()) {
                rpcToken = System.getenv("WALLET_VM_RPC_TOKEN");
            }
            keepAlive = keepAlive || enableRpc || "true".equalsIgnoreCase(System.getenv("WALLET_VM_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    configFile,
                    inMemory,
                    keepAlive,
                    demo,
                    enableRpc,
                    rpcBind,
                    rpcPort,
                    rpcToken
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: wallet-version-manager [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for manager state (default ./data/manager)
  --config=<file>            Manager config JSON (default: built-in local config)
  --in-memory                Keep state in memory instead of RocksDB
  --keep-alive               Keep the manager running until interrupted
  --demo / --no-demo         Enable (default) or disable the demo upgrade flow
  --enable-rpc               Start the RPC server (default bind 127.0.0.1:9090)
  --rpc-bind=<host>          Bind address for the RPC server
  --rpc-port=<port>          Port for the RPC server (default 9090)
  --rpc-token=<token>        Require Bearer/X-API-Key token for the RPC server

Environment overrides:
  WALLET_VM_DATA_DIR         Override --data-dir
  WALLET_VM_CONFIG           Override --config
  WALLET_VM_IN_MEMORY        Set to "true" to use in-memory state
  WALLET_VM_ENABLE_RPC       Set to "true" to enable RPC without CLI flag
  WALLET_VM_RPC_BIND         Bind address for the RPC server
  WALLET_VM_RPC_PORT         Port for the RPC server
  WALLET_VM_RPC_TOKEN        Token for RPC auth (if --rpc-token not supplied)
  WALLET_VM_KEEP_ALIVE       Set to "true" to force keep-alive mode
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }
    }
}
