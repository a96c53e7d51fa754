package com.vidnyan.guard.domain.rule.template;

import com.vidnyan.guard.domain.rule.ToolKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static com.vidnyan.guard.domain.rule.ToolKind.EXEC;
import static com.vidnyan.guard.domain.rule.ToolKind.FILE_DELETE;
import static com.vidnyan.guard.domain.rule.ToolKind.FILE_EDIT;
import static com.vidnyan.guard.domain.rule.ToolKind.FILE_READ;
import static com.vidnyan.guard.domain.rule.ToolKind.FILE_WRITE;
import static com.vidnyan.guard.domain.rule.ToolKind.GIT_OPERATION;
import static com.vidnyan.guard.domain.rule.ToolKind.HTTP_REQUEST;

/**
 * Registry of built-in rule templates.
 */
public class RuleTemplates {

    private static final String FILES = "File/Folder Protection";
    private static final String COMMANDS = "Command Restriction";
    private static final String DATA = "Data Protection";
    private static final String SYSTEM = "System Protection";
    private static final String PROCESS = "App/Process Restriction";
    private static final String NETWORK = "Network";

    private final Map<String, RuleTemplate> templates = new LinkedHashMap<>();

    public RuleTemplates() {
        // File/folder protection
        register("protect_path", "Block access to specific paths (read/write/delete)", FILES,
                List.of("path"), RuleTemplates::protectPath);
        register("prevent_delete", "Prevent deletion of specific files/folders", FILES,
                List.of("path"), RuleTemplates::preventDelete);
        register("prevent_overwrite", "Prevent overwriting important files", FILES,
                List.of("path"), RuleTemplates::preventOverwrite);
        fixed("block_hidden_files", "Block access to hidden/secret files (.env, .ssh, .aws, etc.)", FILES,
                Set.of(EXEC, FILE_READ, FILE_WRITE, FILE_EDIT),
                "\\.(env|secrets|credentials|htpasswd|htaccess|pgpass)",
                "\\.ssh/(id_rsa|id_ed25519|id_ecdsa|config|authorized_keys|known_hosts)",
                "\\.gnupg/",
                "\\.aws/(credentials|config)",
                "\\.kube/config",
                "\\.docker/config\\.json",
                "\\.npmrc",
                "\\.netrc",
                "\\.gitconfig");

        // Command restriction
        register("block_command", "Block specific commands from being executed", COMMANDS,
                List.of("commands"), RuleTemplates::blockCommand);
        fixed("block_sudo", "Block sudo/privilege escalation", COMMANDS, Set.of(EXEC),
                "sudo\\s+",
                "su\\s+-",
                "doas\\s+",
                "pkexec\\s+");
        fixed("block_package_install", "Block package installation (apt, brew, pip, npm, etc.)", COMMANDS,
                Set.of(EXEC),
                "(apt|apt-get)\\s+(install|remove|purge)",
                "brew\\s+(install|uninstall|remove)",
                "(yum|dnf)\\s+(install|remove|erase)",
                "pacman\\s+-(S|R|U)",
                "pip3?\\s+install",
                "npm\\s+(install|i|add)\\s+",
                "cargo\\s+install",
                "gem\\s+install",
                "go\\s+install");
        fixed("block_service_control", "Block service control (systemctl, launchctl, etc.)", COMMANDS,
                Set.of(EXEC),
                "systemctl\\s+(start|stop|restart|enable|disable|mask)",
                "service\\s+\\S+\\s+(start|stop|restart)",
                "launchctl\\s+(load|unload|start|stop|bootstrap|bootout)",
                "initctl\\s+(start|stop|restart)");
        fixed("block_network_tools", "Block network tools (curl, wget, nc, nmap, etc.)", COMMANDS,
                Set.of(EXEC),
                "(?:^|\\s)(curl|wget|httpie|http)\\s+",
                "(?:^|\\s)(nc|ncat|netcat|socat)\\s+",
                "(?:^|\\s)(nmap|masscan)\\s+");
        fixed("block_compiler", "Block compiler execution", COMMANDS, Set.of(EXEC),
                "(?:^|\\s)(gcc|g\\+\\+|clang|clang\\+\\+|cc)\\s+",
                "(?:^|\\s)(rustc|cargo\\s+build|cargo\\s+run)",
                "(?:^|\\s)(javac|kotlinc)\\s+",
                "(?:^|\\s)(make|cmake|ninja)\\s+");

        // Data protection
        fixed("prevent_exfiltration", "Prevent data exfiltration (POST, scp, rsync, etc.)", DATA,
                Set.of(EXEC, HTTP_REQUEST),
                "curl\\s+.*(-X\\s+POST|--data|--upload|-F\\s+)",
                "curl\\s+.*-d\\s+",
                "wget\\s+--post",
                "scp\\s+.*:",
                "rsync\\s+.*:",
                "sftp\\s+",
                "(?:^|\\s)ftp\\s+",
                "nc\\s+.*<",
                "base64.*\\|\\s*(curl|wget|nc)");
        fixed("protect_secrets", "Protect secrets (API keys, tokens, passwords)", DATA,
                Set.of(EXEC, FILE_WRITE, FILE_EDIT, HTTP_REQUEST),
                "(api[_-]?key|secret[_-]?key|access[_-]?token|auth[_-]?token)\\s*[=:]\\s*\\S+",
                "(password|passwd|pwd)\\s*[=:]\\s*\\S+",
                "(PRIVATE[_\\s]KEY|BEGIN\\s+(RSA|EC|DSA|OPENSSH)\\s+PRIVATE)",
                "(sk-[a-zA-Z0-9]{20,}|ghp_[a-zA-Z0-9]{36}|gho_[a-zA-Z0-9]{36})",
                "Bearer\\s+[a-zA-Z0-9\\-._~+/]+=*");
        fixed("protect_database", "Protect database (block DROP, TRUNCATE, mass DELETE)", DATA, Set.of(EXEC),
                "(?i)(DROP|TRUNCATE)\\s+(TABLE|DATABASE|SCHEMA|INDEX)",
                "(?i)DELETE\\s+FROM\\s+\\S+\\s*(;|$|WHERE\\s+1)",
                "(?i)ALTER\\s+TABLE\\s+.*DROP",
                "mongosh?\\s+.*--eval.*drop",
                "redis-cli\\s+.*FLUSHALL",
                "redis-cli\\s+.*FLUSHDB");
        fixed("protect_git", "Protect git (block force push, branch delete, hard reset)", DATA,
                Set.of(EXEC, GIT_OPERATION),
                "git\\s+push\\s+.*(-f|--force)",
                "git\\s+push\\s+.*--force-with-lease",
                "git\\s+branch\\s+-[dD]\\s+",
                "git\\s+push\\s+\\S+\\s+:\\S+",
                "git\\s+reset\\s+--hard",
                "git\\s+clean\\s+-fd");

        // System protection
        fixed("protect_system_config", "Protect system config files (/etc/*, shell rc files)", SYSTEM,
                Set.of(EXEC, FILE_WRITE, FILE_EDIT),
                "(vi|vim|nano|sed|tee|cat\\s*>)\\s+.*/etc/",
                "(chmod|chown)\\s+.*/etc/",
                "/etc/(passwd|shadow|group|sudoers|fstab|hosts)",
                "(vi|vim|nano|sed|tee)\\s+.*(\\.bashrc|\\.zshrc|\\.profile|\\.bash_profile)",
                "/etc/(ssh/sshd_config|resolv\\.conf|nsswitch\\.conf)");
        fixed("block_disk_operations", "Block disk operations (format, partition, dd)", SYSTEM, Set.of(EXEC),
                "(mkfs|fdisk|parted|gdisk|diskutil)\\s+",
                "dd\\s+.*of=/dev/",
                "wipefs\\s+",
                "(?:^|\\s)(format|diskpart)(\\s|$)");
        fixed("block_user_management", "Block user management (add/delete users, change passwords)", SYSTEM,
                Set.of(EXEC),
                "(useradd|userdel|usermod|adduser|deluser)\\s+",
                "(groupadd|groupdel|groupmod)\\s+",
                "(?:^|\\s)passwd\\s+",
                "chpasswd",
                "dscl\\s+.*-(create|delete)\\s+/Users/",
                "sysadminctl\\s+");
        fixed("block_cron_modification", "Block cron/scheduled task modification", SYSTEM,
                Set.of(EXEC, FILE_WRITE, FILE_EDIT),
                "crontab\\s+(-e|-r|-l)",
                "(vi|vim|nano|tee)\\s+.*/etc/cron",
                "(?:^|\\s)at\\s+",
                "(launchctl|systemctl)\\s+.*timer");
        fixed("block_firewall_changes", "Block firewall changes (iptables, ufw, pf)", SYSTEM,
                Set.of(EXEC, FILE_WRITE, FILE_EDIT),
                "(iptables|ip6tables|nft|nftables)\\s+",
                "ufw\\s+(allow|deny|delete|reset|disable)",
                "firewall-cmd\\s+",
                "pfctl\\s+",
                "/etc/(ufw|iptables|nftables)");

        // App/process restriction
        register("block_app", "Block specific app/process execution", PROCESS,
                List.of("commands"), RuleTemplates::blockApp);
        fixed("block_docker", "Block dangerous Docker commands (rm, kill, prune)", PROCESS, Set.of(EXEC),
                "docker\\s+(rm|rmi|kill|stop|prune|system\\s+prune)",
                "docker\\s+container\\s+(rm|kill|stop|prune)",
                "docker\\s+image\\s+(rm|prune)",
                "docker\\s+volume\\s+(rm|prune)",
                "docker\\s+network\\s+(rm|prune)",
                "docker-compose\\s+(down|rm)");
        fixed("block_kill_process", "Block process killing (kill, killall, pkill)", PROCESS, Set.of(EXEC),
                "kill\\s+(-9|-SIGKILL|-KILL)\\s+",
                "killall\\s+",
                "pkill\\s+",
                "kill\\s+\\d+",
                "xkill");

        // Network
        fixed("block_port_open", "Block port opening (listeners, tunnels)", NETWORK, Set.of(EXEC),
                "(nc|ncat|netcat)\\s+.*-l",
                "python3?\\s+.*-m\\s+http\\.server",
                "(socat|ncat)\\s+.*LISTEN",
                "ngrok\\s+",
                "ssh\\s+.*-R\\s+");
        fixed("block_ssh_connection", "Block SSH connections", NETWORK, Set.of(EXEC),
                "ssh\\s+\\S+@",
                "ssh\\s+-i\\s+",
                "sshpass\\s+",
                "ssh-copy-id\\s+");
        fixed("block_dns_change", "Block DNS configuration changes", NETWORK,
                Set.of(EXEC, FILE_WRITE, FILE_EDIT),
                "/etc/resolv\\.conf",
                "networksetup\\s+.*-setdnsservers",
                "resolvectl\\s+",
                "systemd-resolve\\s+");
    }

    public Optional<RuleTemplate> find(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(templates.get(id.trim().toLowerCase(Locale.ROOT)));
    }

    public Collection<RuleTemplate> all() {
        return templates.values();
    }

    private void register(String id, String description, String category, List<String> required,
                          Function<TemplateParams, TemplateExpansion> expander) {
        templates.put(id, new RuleTemplate(id, description, category, required, expander));
    }

    private void fixed(String id, String description, String category, Set<ToolKind> kinds, String... patterns) {
        TemplateExpansion expansion = new TemplateExpansion(List.of(patterns), kinds, description);
        register(id, description, category, List.of(), params -> expansion);
    }

    // --- parameterized expansions ---

    static TemplateExpansion protectPath(TemplateParams params) {
        List<String> paths = params.allPaths();
        List<String> ops = params.operations().isEmpty()
                ? List.of("read", "write", "delete")
                : params.operations();

        List<String> patterns = new ArrayList<>();
        for (String path : paths) {
            String p = RegexEscaper.path(path);
            patterns.add(p);
            patterns.add("(cat|less|head|tail|vi|vim|nano|code|open)\\s+.*" + p);
            patterns.add("(rm|mv|cp|chmod|chown)\\s+.*" + p);
        }

        Set<ToolKind> kinds = EnumSet.of(EXEC);
        for (String op : ops) {
            switch (op.toLowerCase(Locale.ROOT)) {
                case "read" -> kinds.add(FILE_READ);
                case "write" -> {
                    kinds.add(FILE_WRITE);
                    kinds.add(FILE_EDIT);
                }
                case "delete" -> kinds.add(FILE_DELETE);
                default -> { }
            }
        }
        String desc = "Protect path: " + String.join(", ", paths) + " (ops: " + String.join(", ", ops) + ")";
        return new TemplateExpansion(patterns, kinds, desc);
    }

    static TemplateExpansion preventDelete(TemplateParams params) {
        List<String> paths = params.allPaths();
        List<String> patterns = new ArrayList<>();
        for (String path : paths) {
            String p = RegexEscaper.path(path);
            patterns.add("(rm|rmdir|unlink|trash|delete)\\s+.*" + p);
            patterns.add("shred\\s+.*" + p);
        }
        return new TemplateExpansion(patterns, Set.of(EXEC, FILE_DELETE),
                "Prevent delete: " + String.join(", ", paths));
    }

    static TemplateExpansion preventOverwrite(TemplateParams params) {
        List<String> paths = params.allPaths();
        List<String> patterns = new ArrayList<>();
        for (String path : paths) {
            String p = RegexEscaper.path(path);
            patterns.add("(>|tee|cp|mv|dd)\\s+.*" + p);
            patterns.add(p);
        }
        return new TemplateExpansion(patterns, Set.of(EXEC, FILE_WRITE, FILE_EDIT),
                "Prevent overwrite: " + String.join(", ", paths));
    }

    static TemplateExpansion blockCommand(TemplateParams params) {
        List<String> commands = params.commandsOrPatterns();
        List<String> patterns = commands.stream()
                .map(cmd -> "(?:^|\\s|/)" + RegexEscaper.escape(cmd))
                .toList();
        return new TemplateExpansion(patterns, Set.of(EXEC), "Block commands: " + String.join(", ", commands));
    }

    static TemplateExpansion blockApp(TemplateParams params) {
        List<String> apps = params.commandsOrPatterns();
        List<String> patterns = new ArrayList<>();
        for (String app : apps) {
            String escaped = RegexEscaper.escape(app);
            patterns.add("(?:^|\\s|/)" + escaped + "(\\s|$)");
            patterns.add("open\\s+.*" + escaped + ".*\\.app");
        }
        return new TemplateExpansion(patterns, Set.of(EXEC), "Block apps: " + String.join(", ", apps));
    }
}
