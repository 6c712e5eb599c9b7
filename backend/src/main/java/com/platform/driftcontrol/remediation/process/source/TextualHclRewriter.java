package com.platform.driftcontrol.remediation.process.source;

import com.platform.driftcontrol.error.SourceRewriteException;
import com.platform.driftcontrol.remediation.RemediationAction;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented HCL rewriter.
 * 
 * Locates the {@code resource} block for the action's resource in the {@code .tf} files
 * under the root, then replaces the assignment of the last path segment (indices stripped)
 * inside that block. A map or list value spanning several lines is replaced up to its
 * matching close bracket; heredoc values are rejected.
 */
@Slf4j
public class TextualHclRewriter implements SourceRewriter {
    
    private static final String TF_EXTENSION = ".tf";
    private static final Pattern INDEX = Pattern.compile("\\[\\d+]");
    
    @Override
    public SourceRewrite rewrite(Path root, RemediationAction action) {
        String resourceName = action.getResourceName();
        Pattern header = resourceHeader(resourceName);
        
        Path file = findResourceFile(root, header)
            .orElseThrow(() -> SourceRewriteException.resourceNotFound(resourceName, root));
        
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            String[] lines = content.split("\n", -1);
            
            int lineIndex = findAssignment(lines, header, propertyKey(action.getPropertyPath()));
            if (lineIndex < 0) {
                throw SourceRewriteException.propertyNotFound(resourceName, action.getPropertyPath(), file);
            }
            
            Matcher m = assignment(propertyKey(action.getPropertyPath())).matcher(lines[lineIndex]);
            if (!m.matches()) {
                throw SourceRewriteException.propertyNotFound(resourceName, action.getPropertyPath(), file);
            }
            int lastLine = valueEnd(lines, lineIndex, m.group(2), action, file);
            
            String before = String.join("\n", Arrays.asList(lines).subList(lineIndex, lastLine + 1));
            String after = m.group(1) + HclValues.format(action.getCurrentValue());
            
            List<String> updated = new ArrayList<>(Arrays.asList(lines).subList(0, lineIndex));
            updated.add(after);
            updated.addAll(Arrays.asList(lines).subList(lastLine + 1, lines.length));
            
            Files.writeString(file, String.join("\n", updated), StandardCharsets.UTF_8);
            log.info("Updated {} in {} lines {}-{}", action.getPropertyPath(), file, lineIndex + 1, lastLine + 1);
            return new SourceRewrite(file, lineIndex + 1, before, after);
            
        } catch (IOException e) {
            throw new SourceRewriteException(resourceName, action.getPropertyPath(),
                "Failed to rewrite " + file + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * {@code type.name} addresses match that exact block; a bare name matches any type.
     */
    static Pattern resourceHeader(String resourceName) {
        int dot = resourceName.lastIndexOf('.');
        String type = dot > 0 ? Pattern.quote(resourceName.substring(0, dot)) : "[^\"]+";
        String name = Pattern.quote(dot > 0 ? resourceName.substring(dot + 1) : resourceName);
        return Pattern.compile("^\\s*resource\\s+\"" + type + "\"\\s+\"" + name + "\"\\s*\\{");
    }
    
    /**
     * Last path segment with list indices removed: {@code ingress[0].cidr_blocks} becomes {@code cidr_blocks}.
     */
    static String propertyKey(String propertyPath) {
        String stripped = INDEX.matcher(propertyPath).replaceAll("");
        int dot = stripped.lastIndexOf('.');
        return dot >= 0 ? stripped.substring(dot + 1) : stripped;
    }
    
    private static Pattern assignment(String key) {
        String quoted = Pattern.quote(key);
        return Pattern.compile("^(\\s*(?:" + quoted + "|\"" + quoted + "\")\\s*=\\s*)(.*)$");
    }
    
    private Optional<Path> findResourceFile(Path root, Pattern header) {
        List<Path> candidates = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && dir.getFileName().toString().startsWith(".")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }
                
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (file.getFileName().toString().endsWith(TF_EXTENSION)) {
                        candidates.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
        
        candidates.sort(null);
        for (Path candidate : candidates) {
            try {
                for (String line : Files.readAllLines(candidate, StandardCharsets.UTF_8)) {
                    if (header.matcher(line).find()) {
                        return Optional.of(candidate);
                    }
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable terraform file {}: {}", candidate, e.getMessage());
            }
        }
        return Optional.empty();
    }
    
    /**
     * @return index of the assignment line inside the resource block, or -1
     */
    private int findAssignment(String[] lines, Pattern header, String key) {
        Pattern assignment = assignment(key);
        BracketScanner scanner = new BracketScanner();
        int depth = 0;
        boolean inBlock = false;
        
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            boolean commented = scanner.inBlockComment();
            if (!inBlock) {
                int delta = scanner.delta(line, false);
                if (!commented && header.matcher(line).find()) {
                    inBlock = true;
                    depth = delta;
                    if (depth <= 0) {
                        return -1;
                    }
                }
                continue;
            }
            if (!commented && assignment.matcher(line).matches()) {
                return i;
            }
            depth += scanner.delta(line, false);
            if (depth <= 0) {
                return -1;
            }
        }
        return -1;
    }
    
    /**
     * @return index of the line holding the end of the value that starts at {@code firstLine}
     */
    private static int valueEnd(String[] lines, int firstLine, String value, RemediationAction action, Path file) {
        if (value.strip().startsWith("<<")) {
            throw new SourceRewriteException(action.getResourceName(), action.getPropertyPath(),
                String.format("Heredoc value of %s in resource %s (%s) cannot be rewritten",
                    action.getPropertyPath(), action.getResourceName(), file));
        }
        BracketScanner scanner = new BracketScanner();
        int depth = scanner.delta(value, true);
        int last = firstLine;
        while (depth > 0) {
            last++;
            if (last >= lines.length) {
                throw new SourceRewriteException(action.getResourceName(), action.getPropertyPath(),
                    String.format("Unterminated value of %s in resource %s (%s)",
                        action.getPropertyPath(), action.getResourceName(), file));
            }
            depth += scanner.delta(lines[last], true);
        }
        return last;
    }
    
    /**
     * Bracket depth tracking across lines. Quoted strings, line comments ({@code #}, {@code //})
     * and block comments are skipped; a block comment may span lines.
     */
    static final class BracketScanner {
        
        private boolean inBlockComment;
        
        boolean inBlockComment() {
            return inBlockComment;
        }
        
        int delta(String line, boolean countSquare) {
            int delta = 0;
            boolean inString = false;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                char next = i + 1 < line.length() ? line.charAt(i + 1) : '\0';
                if (inBlockComment) {
                    if (c == '*' && next == '/') {
                        inBlockComment = false;
                        i++;
                    }
                } else if (inString) {
                    if (c == '\\') {
                        i++;
                    } else if (c == '"') {
                        inString = false;
                    }
                } else if (c == '"') {
                    inString = true;
                } else if (c == '#' || (c == '/' && next == '/')) {
                    break;
                } else if (c == '/' && next == '*') {
                    inBlockComment = true;
                    i++;
                } else if (c == '{' || (countSquare && c == '[')) {
                    delta++;
                } else if (c == '}' || (countSquare && c == ']')) {
                    delta--;
                }
            }
            return delta;
        }
    }
}
