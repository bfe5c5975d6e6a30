package io.rtpi.workspace.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface RtpiWorkspaceSessionMapper extends BaseMapper<RtpiWorkspaceSession> {
}
