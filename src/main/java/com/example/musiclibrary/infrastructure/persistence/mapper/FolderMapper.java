package com.example.musiclibrary.infrastructure.persistence.mapper;

import com.example.musiclibrary.infrastructure.persistence.entity.FolderEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface FolderMapper {

    @Insert("INSERT INTO folder(path, path_hash, name, last_modified_date) "
            + "VALUES(#{path}, #{pathHash}, #{name}, #{lastModifiedDate})")
    @Options(useGeneratedKeys = true, keyProperty = "id")
    int insert(FolderEntity entity);

    @Select("SELECT id, path, path_hash, name, last_modified_date, created_at, updated_at "
            + "FROM folder WHERE id = #{id}")
    FolderEntity selectById(@Param("id") Long id);

    @Select("SELECT id, path, path_hash, name, last_modified_date, created_at, updated_at "
            + "FROM folder WHERE path_hash = #{pathHash}")
    FolderEntity selectByPathHash(@Param("pathHash") String pathHash);

    @Select("SELECT id, path, path_hash, name, last_modified_date, created_at, updated_at "
            + "FROM folder ORDER BY id")
    List<FolderEntity> selectAll();

    @Update("UPDATE folder SET last_modified_date = #{lastModifiedDate}, updated_at = NOW() WHERE id = #{id}")
    int updateLastModifiedDate(@Param("id") Long id, @Param("lastModifiedDate") LocalDateTime lastModifiedDate);

    @Delete("DELETE FROM folder WHERE id = #{id}")
    int deleteById(@Param("id") Long id);
}
