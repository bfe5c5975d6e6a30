package io.rtpi.workspace.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import io.rtpi.workspace.entity.RtpiWorkspace;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface RtpiWorkspaceMapper extends BaseMapper<RtpiWorkspace> {
}
