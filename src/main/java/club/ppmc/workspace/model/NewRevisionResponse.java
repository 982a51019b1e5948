/**
 * NewRevisionResponse.java
 *
 * 快照或导入成功后返回的新修订版本号。
 */
package club.ppmc.workspace.model;

public record NewRevisionResponse(long id) {}
