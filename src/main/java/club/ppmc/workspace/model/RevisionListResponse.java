/**
 * RevisionListResponse.java
 *
 * 修订版本列表。由于修订版本从不删除，{@code list} 总是 0..latest 的连续升序序列。
 */
package club.ppmc.workspace.model;

import java.util.List;

/**
 * @param latest 当前 HEAD。
 * @param list 所有存在的修订版本号。
 */
public record RevisionListResponse(long latest, List<Long> list) {}
