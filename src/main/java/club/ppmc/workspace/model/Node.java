/**
 * Node.java
 *
 * 文件树中的一个节点（文件或目录），由 FileTreeService 构建，并由 FileController 以 JSON 返回给前端。
 * 与请求/响应记录不同，此类是可变的 POJO，便于在递归遍历时逐步填充子节点。
 */
package club.ppmc.workspace.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class Node {

    /** 节点名称 (文件名或目录名) */
    private String name;

    /** 节点相对于所在修订版本根目录的路径，统一使用 "/" 分隔 */
    private String path;

    /** 是否为目录 */
    @JsonProperty("isDirectory")
    private boolean directory;

    /** 最后修改时间，单位为秒 */
    private long modified;

    /** 文件大小（字节），目录此项为 null */
    private Long size;

    /** 子节点列表，仅目录有效；文件不输出该字段 */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<Node> children;
}
