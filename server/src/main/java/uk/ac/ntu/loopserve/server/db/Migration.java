package uk.ac.ntu.loopserve.server.db;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record Migration(int id, String name, String up, String down) {
    private static final Pattern FILE_NAME = Pattern.compile("^(\\d+)\\.(.+)\\.sql$");
    private static final Pattern UP = Pattern.compile("^--\\s*Up\\b.*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern DOWN = Pattern.compile("^--\\s*Down\\b.*$", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    static boolean isScript(String fileName) {
        return fileName.endsWith(".sql");
    }

    static Migration parse(String fileName, String text) throws MigrationException {
        Matcher m = FILE_NAME.matcher(fileName);
        if (!m.matches()) {
            throw new MigrationException("Migration file name must look like <id>.<name>.sql: " + fileName);
        }
        int id;
        try {
            id = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new MigrationException("Migration id out of range: " + fileName, e);
        }

        Matcher up = UP.matcher(text);
        Matcher down = DOWN.matcher(text);
        boolean hasUp = up.find();
        boolean hasDown = down.find();

        String upSql;
        String downSql = "";
        if (hasDown) {
            int upStart = hasUp && up.end() <= down.start() ? up.end() : 0;
            upSql = text.substring(upStart, down.start());
            downSql = text.substring(down.end());
        } else {
            upSql = hasUp ? text.substring(up.end()) : text;
        }
        return new Migration(id, m.group(2), upSql.trim(), downSql.trim());
    }
}
