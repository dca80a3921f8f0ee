package com.shellscan.syntax;

public class ShellTextRenderer {

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(128));

    public String render(SimpleCommand command) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        for (CommandPrefixOrSuffixItem item : command.prefix()) {
            separate(sb);
            renderItem(item, sb);
        }
        if (command.wordOrName() != null) {
            separate(sb);
            sb.append(command.wordOrName().value());
        }
        for (CommandPrefixOrSuffixItem item : command.suffix()) {
            separate(sb);
            renderItem(item, sb);
        }

        return sb.toString();
    }

    private void renderItem(CommandPrefixOrSuffixItem item, StringBuilder sb) {
        if (item instanceof CommandPrefixOrSuffixItem.Redirect r) {
            renderRedirect(r.redirect(), sb);
        } else if (item instanceof CommandPrefixOrSuffixItem.AssignmentWord a) {
            sb.append(a.word().value());
        } else if (item instanceof CommandPrefixOrSuffixItem.WordItem w) {
            sb.append(w.word().value());
        } else if (item instanceof CommandPrefixOrSuffixItem.Substitution s) {
            renderSubstitution(s.substitution(), sb);
        }
    }

    private void renderRedirect(IoRedirect redirect, StringBuilder sb) {
        if (redirect instanceof IoRedirect.File file) {
            appendFd(file.fd(), sb);
            sb.append(file.kind().symbol());
            if (file.target() instanceof IoRedirect.Target.Fd fd) {
                sb.append(fd.fd());
            } else if (file.target() instanceof IoRedirect.Target.Filename filename) {
                if (!file.kind().isDuplicate()) {
                    sb.append(' ');
                }
                sb.append(filename.word().value());
            } else if (file.target() instanceof IoRedirect.Target.Substitution s) {
                sb.append(' ');
                renderSubstitution(s.substitution(), sb);
            }
        } else if (redirect instanceof IoRedirect.HereDocument hereDoc) {
            appendFd(hereDoc.fd(), sb);
            sb.append(hereDoc.removeTabs() ? "<<-" : "<<").append(hereDoc.hereEnd().value());
        } else if (redirect instanceof IoRedirect.HereString hereString) {
            appendFd(hereString.fd(), sb);
            sb.append("<<< ").append(hereString.word().value());
        } else if (redirect instanceof IoRedirect.OutputAndError outputAndError) {
            sb.append(outputAndError.append() ? "&>> " : "&> ").append(outputAndError.word().value());
        }
    }

    private static void renderSubstitution(ProcessSubstitution substitution, StringBuilder sb) {
        sb.append(substitution.kind().symbol()).append('(').append(substitution.text()).append(')');
    }

    private static void appendFd(Integer fd, StringBuilder sb) {
        if (fd != null) {
            sb.append(fd);
        }
    }

    private static void separate(StringBuilder sb) {
        if (!sb.isEmpty()) {
            sb.append(' ');
        }
    }
}
