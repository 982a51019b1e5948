/**
 * SearchHit.java
 *
 * 一条搜索命中记录：命中文件的路径，以及命中方式（文件名或文件内容）。
 */
package club.ppmc.workspace.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * @param path 相对于当前修订版本根目录的路径，统一使用 "/" 分隔。
 * @param matched 命中方式。
 */
public record SearchHit(String path, MatchKind matched) {

    public enum MatchKind {
        NAME("name"),
        CONTENT("content");

        private final String value;

        MatchKind(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
